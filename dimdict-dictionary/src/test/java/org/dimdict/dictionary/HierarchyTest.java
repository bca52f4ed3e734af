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

import org.dimdict.data.attribute.AttributeUnderlyingType;
import org.dimdict.data.block.Block;
import org.dimdict.data.key.KeyShape;
import org.dimdict.data.structure.DictionaryAttribute;
import org.dimdict.data.structure.DictionaryStructure;
import org.dimdict.loader.LoadException;
import org.dimdict.testutil.TestDictionarySource;
import org.dimdict.threads.ExecutorManager;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

/**
 * Tests the hierarchy queries of {@link HashedDictionary}.
 *
 * @author Bastian Gloeckle
 */
public class HierarchyTest {
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
    return new Object[][] { { 1 }, { 4 } };
  }

  @Test(dataProvider = "shards")
  public void chainDescendantsTest(int shards) throws LoadException {
    // GIVEN
    // 1 -> 2 -> 3 -> 10, 10 is not a key itself.
    HashedDictionary<Long> dict = load(shards, DictionaryTestData.hierarchyBlock( //
        new long[] { 1, 2 }, new long[] { 2, 3 }, new long[] { 3, 10 }));

    // WHEN
    long[] all = dict.getDescendants(10, 0);
    long[] children = dict.getDescendants(10, 1);
    long[] twoLevels = dict.getDescendants(10, 2);

    // THEN
    Arrays.sort(all);
    Assert.assertEquals(all, new long[] { 1, 2, 3 });
    Assert.assertEquals(children, new long[] { 3 });
    Arrays.sort(twoLevels);
    Assert.assertEquals(twoLevels, new long[] { 2, 3 });
    Assert.assertEquals(dict.getDescendants(1, 0), new long[0], "Leaf should not have descendants");
    Assert.assertTrue(dict.isInHierarchy(1, 10));
    Assert.assertFalse(dict.isInHierarchy(10, 1));
  }

  @Test(dataProvider = "shards")
  public void getHierarchyTest(int shards) throws LoadException {
    // GIVEN
    HashedDictionary<Long> dict = load(shards, DictionaryTestData.hierarchyBlock( //
        new long[] { 1, 2 }, new long[] { 2, 3 }, new long[] { 3, 10 }, new long[] { 4, 0 }, new long[] { 5, 5 }));

    // WHEN
    long[][] res = dict.getHierarchy(new long[] { 1, 3, 4, 5, 99 });

    // THEN
    Assert.assertEquals(res[0], new long[] { 1, 2, 3, 10 }, "Parents that are no keys should be included");
    Assert.assertEquals(res[1], new long[] { 3, 10 });
    Assert.assertEquals(res[2], new long[] { 4 }, "Null value as parent should end the chain");
    Assert.assertEquals(res[3], new long[] { 5 }, "Key being its own parent should end the chain");
    Assert.assertEquals(res[4], new long[0], "Unknown key should have an empty hierarchy");
  }

  @Test
  public void isInHierarchyTest() throws LoadException {
    // GIVEN
    HashedDictionary<Long> dict = load(2, DictionaryTestData.hierarchyBlock( //
        new long[] { 1, 2 }, new long[] { 2, 3 }, new long[] { 3, 0 }));

    // THEN
    Assert.assertTrue(dict.isInHierarchy(1, 3));
    Assert.assertTrue(dict.isInHierarchy(1, 1), "Key should be in its own hierarchy");
    Assert.assertFalse(dict.isInHierarchy(3, 1));
    Assert.assertFalse(dict.isInHierarchy(99, 99), "Unknown keys are in no hierarchy");
    Assert.assertEquals(dict.isInHierarchy(new long[] { 1, 2, 3 }, new long[] { 2, 1, 3 }),
        new boolean[] { true, false, true });
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void isInHierarchyLengthMismatchTest() throws LoadException {
    HashedDictionary<Long> dict = load(1, DictionaryTestData.hierarchyBlock(new long[] { 1, 0 }));
    dict.isInHierarchy(new long[] { 1, 2 }, new long[] { 1 });
  }

  @Test(dataProvider = "shards")
  public void cycleTest(int shards) throws LoadException {
    // GIVEN
    HashedDictionary<Long> dict =
        load(shards, DictionaryTestData.hierarchyBlock(new long[] { 7, 8 }, new long[] { 8, 7 }));

    // THEN
    Assert.assertTrue(dict.isInHierarchy(7, 8));
    Assert.assertFalse(dict.isInHierarchy(7, 9));
    Assert.assertEquals(dict.getDescendants(7, 0), new long[] { 8 });
    Assert.assertEquals(dict.getHierarchy(new long[] { 7 })[0], new long[] { 7, 8 });
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void negativeLevelTest() throws LoadException {
    HashedDictionary<Long> dict = load(1, DictionaryTestData.hierarchyBlock(new long[] { 1, 0 }));
    dict.getDescendants(1, -1);
  }

  @Test
  public void indexIsInvalidatedOnUpdateTest() throws LoadException {
    // GIVEN
    TestDictionarySource source = TestDictionarySource
        .withUpdateField(Arrays.asList(DictionaryTestData.hierarchyBlock(new long[] { 1, 10 }, new long[] { 2, 10 })));
    HashedDictionary<Long> dict = new HashedDictionary<>("hier", DictionaryTestData.STRUCTURE, KeyShape.SIMPLE,
        source, HashedDictionaryConfiguration.defaults().withShards(2), executorManager);
    dict.loadData();
    Assert.assertEquals(dict.getDescendants(10, 1).length, 2);
    Assert.assertTrue(dict.getHierarchicalIndexBytesAllocated() > 0, "Expected index to be accounted");

    // WHEN
    source.addUpdate(DictionaryTestData.hierarchyBlock(new long[] { 2, 20 }, new long[] { 3, 10 }));
    dict.updateData();

    // THEN
    Assert.assertEquals(dict.getHierarchicalIndexBytesAllocated(), 0L, "Index should have been dropped");
    long[] children = dict.getDescendants(10, 1);
    Arrays.sort(children);
    Assert.assertEquals(children, new long[] { 1, 3 });
    Assert.assertEquals(dict.getDescendants(20, 0), new long[] { 2 });
  }

  @Test
  public void vectorizedHierarchyTest() throws LoadException {
    // GIVEN
    HashedDictionary<Long> dict = load(3, DictionaryTestData.hierarchyBlock( //
        new long[] { 1, 0 }, new long[] { 2, 1 }, new long[] { 3, 1 }, new long[] { 4, 2 }));

    // WHEN
    long[][] res = dict.getHierarchy(new long[] { 4, 3, 1 });

    // THEN
    Assert.assertEquals(res.length, 3);
    Assert.assertEquals(res[0], new long[] { 4, 2, 1 });
    Assert.assertEquals(res[1], new long[] { 3, 1 });
    Assert.assertEquals(res[2], new long[] { 1 });
    long[] descendants = dict.getDescendants(1, 0);
    Arrays.sort(descendants);
    Assert.assertEquals(descendants, new long[] { 2, 3, 4 });
  }

  @Test(expectedExceptions = UnsupportedHierarchyQueryException.class)
  public void noHierarchicalAttributeTest() throws LoadException {
    // GIVEN
    DictionaryStructure structure =
        DictionaryStructure.simple("id", Arrays.asList(DictionaryAttribute.of("name", AttributeUnderlyingType.STRING)));
    HashedDictionary<Long> dict = new HashedDictionary<>("flat", structure, KeyShape.SIMPLE,
        TestDictionarySource.of(new Block(Arrays.asList("id", "name"),
            Arrays.asList(new Object[] { 1L }, new Object[] { "a" }))),
        HashedDictionaryConfiguration.defaults(), executorManager);
    dict.loadData();

    // WHEN
    dict.getDescendants(1, 0);
  }

  private HashedDictionary<Long> load(int shards, Block block) throws LoadException {
    HashedDictionary<Long> res = new HashedDictionary<>("hier", DictionaryTestData.STRUCTURE, KeyShape.SIMPLE,
        TestDictionarySource.of(block), HashedDictionaryConfiguration.defaults().withShards(shards), executorManager);
    res.loadData();
    return res;
  }
}
