/**
 * dimdict: Dimension Dictionary.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of dimdict.
 *
 * dimdict is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.dimdict.dictionary;

import java.util.Arrays;

import org.dimdict.data.key.KeyShape;
import org.dimdict.loader.LoadException;
import org.dimdict.loader.SourceExhaustedPrematurelyException;
import org.dimdict.testutil.TestDictionarySource;
import org.dimdict.threads.ExecutorManager;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

/**
 * Tests {@link HashedDictionary} on sources that provide changed rows only.
 *
 * @author Bastian Gloeckle
 */
public class UpdateDataTest {
  private ExecutorManager executorManager;

  @BeforeMethod
  public void before() {
    executorManager = new ExecutorManager();
  }

  @AfterMethod
  public void after() {
    executorManager.shutdownEverything();
  }

  @DataProvider(name = "shards")
  public Object[][] shards() {
    return new Object[][] { { 1 }, { 3 } };
  }

  @Test(dataProvider = "shards")
  public void updatesAreMergedTest(int shards) throws LoadException {
    // GIVEN
    TestDictionarySource source = TestDictionarySource.withUpdateField(DictionaryTestData.blocks(0, 2, 10));
    HashedDictionary<Long> dict = create(source, shards);
    dict.loadData();

    // WHEN
    source.addUpdate(DictionaryTestData.row(3, "changed", 33L, 0), DictionaryTestData.row(100, "new", null, 0));
    dict.updateData();

    // THEN
    Assert.assertEquals(dict.getElementCount(), 21L);
    ColumnResult<String> names =
        dict.getColumn("name", String.class, DictionaryTestData.keys(3, 4, 100), DefaultValues.single("?"));
    Assert.assertEquals(names.getValues(), Arrays.asList("changed", "name4", "new"));
    ColumnResult<Long> values =
        dict.getColumn("value", Long.class, DictionaryTestData.keys(3, 100), DefaultValues.single(0L));
    Assert.assertEquals(values.getValue(0), (Long) 33L);
    Assert.assertTrue(values.isNull(1), "Expected new row to be null");
    Assert.assertEquals(source.getLoadAllCalls(), 0);
    Assert.assertEquals(source.getLoadUpdatedAllCalls(), 2);
  }

  @Test
  public void nullValueIsReplacedByUpdateTest() throws LoadException {
    // GIVEN
    TestDictionarySource source = TestDictionarySource
        .withUpdateField(Arrays.asList(DictionaryTestData.row(1, "a", null, 0)));
    HashedDictionary<Long> dict = create(source, 1);
    dict.loadData();
    Assert.assertTrue(
        dict.getColumn("value", Long.class, DictionaryTestData.keys(1), DefaultValues.single(0L)).isNull(0));

    // WHEN
    source.addUpdate(DictionaryTestData.row(1, "a", 5L, 0));
    dict.updateData();

    // THEN
    ColumnResult<Long> res = dict.getColumn("value", Long.class, DictionaryTestData.keys(1), DefaultValues.single(0L));
    Assert.assertFalse(res.isNull(0));
    Assert.assertEquals(res.getValue(0), (Long) 5L);
  }

  @Test
  public void emptyUpdateKeepsDataTest() throws LoadException {
    // GIVEN
    TestDictionarySource source = TestDictionarySource.withUpdateField(DictionaryTestData.blocks(0, 1, 10));
    HashedDictionary<Long> dict = create(source, 2);
    dict.loadData();

    // WHEN
    dict.updateData();

    // THEN
    Assert.assertEquals(dict.getElementCount(), 10L);
  }

  @Test(dataProvider = "shards")
  public void copyUsesBufferedRowsTest(int shards) throws LoadException {
    // GIVEN
    TestDictionarySource source = TestDictionarySource.withUpdateField(DictionaryTestData.blocks(0, 1, 10));
    HashedDictionary<Long> dict = create(source, shards);
    dict.loadData();
    source.addUpdate(DictionaryTestData.row(1, "one", 1L, 0));
    dict.updateData();
    source.addUpdate(DictionaryTestData.row(50, "fifty", 50L, 0));

    // WHEN
    HashedDictionary<Long> copy = dict.copy();

    // THEN
    TestDictionarySource copiedSource = (TestDictionarySource) copy.getSource();
    Assert.assertEquals(copiedSource.getLoadAllCalls(), 0, "Copy should not load all data again");
    Assert.assertEquals(copy.getElementCount(), 11L);
    Assert.assertEquals(copy.getColumn("name", String.class, DictionaryTestData.keys(1, 2, 50), DefaultValues.single(""))
        .getValues(), Arrays.asList("one", "name2", "fifty"));
    Assert.assertEquals(dict.getElementCount(), 10L, "Original should not see the change fetched by the copy");
  }

  @Test
  public void reloadRebuildsFromBufferTest() throws LoadException {
    // GIVEN
    TestDictionarySource source = TestDictionarySource.withUpdateField(DictionaryTestData.blocks(0, 2, 5));
    HashedDictionary<Long> dict = create(source, 2);
    dict.loadData();
    source.addUpdate(DictionaryTestData.row(0, "zero", 0L, 0));

    // WHEN
    dict.reload();

    // THEN
    Assert.assertEquals(dict.getElementCount(), 10L);
    Assert.assertEquals(
        dict.getColumn("name", String.class, DictionaryTestData.keys(0), DefaultValues.single("")).getValue(0), "zero");
    Assert.assertEquals(source.getLoadAllCalls(), 0);
  }

  @Test
  public void failedUpdateKeepsMergedRowsTest() throws LoadException {
    // GIVEN
    TestDictionarySource source = TestDictionarySource.withUpdateField(DictionaryTestData.blocks(0, 1, 5));
    HashedDictionary<Long> dict = create(source, 1);
    dict.loadData();
    source.addUpdate(DictionaryTestData.row(10, "ten", 10L, 0), DictionaryTestData.row(11, "eleven", 11L, 0));
    source.failAfterBlocks(1);

    // WHEN
    try {
      dict.updateData();
      Assert.fail("Expected update to fail");
    } catch (SourceExhaustedPrematurelyException e) {
      // expected
    }

    // THEN
    Assert.assertEquals(dict.hasKeys(DictionaryTestData.keys(0, 10, 11)), new boolean[] { true, true, false });
    Assert.assertEquals(dict.getElementCount(), 6L);
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void updateWithoutUpdateFieldTest() throws LoadException {
    HashedDictionary<Long> dict = create(TestDictionarySource.of(DictionaryTestData.blocks(0, 1, 5)), 1);
    dict.loadData();
    dict.updateData();
  }

  private HashedDictionary<Long> create(TestDictionarySource source, int shards) {
    return new HashedDictionary<>("upd", DictionaryTestData.STRUCTURE, KeyShape.SIMPLE, source,
        HashedDictionaryConfiguration.defaults().withShards(shards), executorManager);
  }
}
