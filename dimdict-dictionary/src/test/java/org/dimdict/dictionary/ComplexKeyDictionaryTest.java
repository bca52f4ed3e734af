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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.dimdict.data.attribute.AttributeUnderlyingType;
import org.dimdict.data.block.Block;
import org.dimdict.data.container.HashTableBackend;
import org.dimdict.data.key.ByteSpan;
import org.dimdict.data.key.DictionaryKeyType;
import org.dimdict.data.key.KeyShape;
import org.dimdict.data.structure.DictionaryAttribute;
import org.dimdict.data.structure.DictionaryStructure;
import org.dimdict.loader.BlockReader;
import org.dimdict.loader.LoadException;
import org.dimdict.testutil.TestDictionarySource;
import org.dimdict.threads.ExecutorManager;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

/**
 * Tests {@link HashedDictionary} with keys consisting of a string and an integer column.
 *
 * @author Bastian Gloeckle
 */
public class ComplexKeyDictionaryTest {
  private static final DictionaryStructure STRUCTURE = DictionaryStructure.complex(
      Arrays.asList(DictionaryAttribute.of("country", AttributeUnderlyingType.STRING),
          DictionaryAttribute.of("zip", AttributeUnderlyingType.UINT32)),
      Arrays.asList(DictionaryAttribute.of("city", AttributeUnderlyingType.STRING),
          DictionaryAttribute.of("population", AttributeUnderlyingType.UINT64).withNullValue(7L)));

  private static final List<String> COLUMNS = Arrays.asList("country", "zip", "city", "population");

  private ExecutorManager executorManager;

  @BeforeMethod
  public void before() {
    executorManager = new ExecutorManager();
  }

  @AfterMethod
  public void after() {
    executorManager.shutdownEverything();
  }

  @DataProvider(name = "configurations")
  public Object[][] configurations() {
    return new Object[][] { //
        { HashedDictionaryConfiguration.defaults() }, //
        { HashedDictionaryConfiguration.defaults().withShards(4) }, //
        { HashedDictionaryConfiguration.defaults().withShards(2).withBackend(HashTableBackend.SPARSE) } //
    };
  }

  @Test(dataProvider = "configurations")
  public void lookupTest(HashedDictionaryConfiguration config) throws LoadException {
    // GIVEN
    HashedDictionary<ByteSpan> dict = load(config, cities());

    // WHEN
    List<Object[]> keys = Arrays.asList(new Object[] { "DE", "DE", "US", "DE" }, new Object[] { 80331L, 10115L,
        10115L, 1L });
    ColumnResult<String> cities = dict.getColumn("city", String.class, keys, DefaultValues.single("unknown"));
    ColumnResult<Long> population = dict.getColumn("population", Long.class, keys, DefaultValues.attributeNullValue());

    // THEN
    Assert.assertEquals(dict.getElementCount(), 3L);
    Assert.assertEquals(cities.getValues(), Arrays.asList("Munich", "Berlin", "New York", "unknown"));
    Assert.assertEquals(population.getValues(), Arrays.asList(1_500_000L, 3_600_000L, 8_000_000L, 7L));
    Assert.assertEquals(dict.hasKeys(keys), new boolean[] { true, true, true, false });
    Assert.assertEquals(dict.getQueryCount(), 12L);
    Assert.assertEquals(dict.getFoundCount(), 9L);
  }

  @Test
  public void keyPrefixesDoNotCollideTest() throws LoadException {
    // GIVEN
    DictionaryStructure structure = DictionaryStructure.complex(
        Arrays.asList(DictionaryAttribute.of("a", AttributeUnderlyingType.STRING),
            DictionaryAttribute.of("b", AttributeUnderlyingType.STRING)),
        Arrays.asList(DictionaryAttribute.of("v", AttributeUnderlyingType.INT64)));
    Block block = new Block(Arrays.asList("a", "b", "v"),
        Arrays.asList(new Object[] { "ab", "a" }, new Object[] { "c", "bc" }, new Object[] { 1L, 2L }));
    HashedDictionary<ByteSpan> dict = new HashedDictionary<>("prefix", structure, KeyShape.COMPLEX,
        TestDictionarySource.of(block), HashedDictionaryConfiguration.defaults(), executorManager);

    // WHEN
    dict.loadData();

    // THEN
    Assert.assertEquals(dict.getElementCount(), 2L);
    Assert.assertEquals(dict.getColumn("v", Long.class,
        Arrays.asList(new Object[] { "a", "ab" }, new Object[] { "bc", "c" }), DefaultValues.single(0L)).getValues(),
        Arrays.asList(2L, 1L));
  }

  @Test
  public void readDecodesKeysTest() throws LoadException {
    // GIVEN
    HashedDictionary<ByteSpan> dict = load(HashedDictionaryConfiguration.defaults().withShards(3), cities());

    // WHEN
    List<BlockReader> streams = dict.read(Arrays.asList("zip", "country", "city"), 2, 2);

    // THEN
    Map<String, String> res = new HashMap<>();
    for (BlockReader stream : streams) {
      Block block;
      while ((block = stream.read()) != null)
        for (int row = 0; row < block.getNumberOfRows(); row++)
          res.put(block.getColumn("country")[row] + "-" + block.getColumn("zip")[row],
              (String) block.getColumn("city")[row]);
    }
    Map<String, String> expected = new HashMap<>();
    expected.put("DE-80331", "Munich");
    expected.put("DE-10115", "Berlin");
    expected.put("US-10115", "New York");
    Assert.assertEquals(res, expected);
  }

  @Test
  public void typeNameTest() throws LoadException {
    HashedDictionary<ByteSpan> dense = load(HashedDictionaryConfiguration.defaults(), cities());
    HashedDictionary<ByteSpan> sparse =
        load(HashedDictionaryConfiguration.defaults().withBackend(HashTableBackend.SPARSE), cities());

    Assert.assertEquals(dense.getTypeName(), "ComplexKeyHashed");
    Assert.assertEquals(sparse.getTypeName(), "ComplexKeySparseHashed");
    Assert.assertEquals(dense.getKeyType(), DictionaryKeyType.COMPLEX);
    Assert.assertFalse(dense.hasHierarchy());
  }

  @Test(expectedExceptions = UnsupportedHierarchyQueryException.class)
  public void hierarchyUnsupportedTest() throws LoadException {
    HashedDictionary<ByteSpan> dict = load(HashedDictionaryConfiguration.defaults(), cities());
    dict.isInHierarchy(1, 2);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void wrongNumberOfKeyColumnsTest() throws LoadException {
    HashedDictionary<ByteSpan> dict = load(HashedDictionaryConfiguration.defaults(), cities());
    dict.hasKeys(Arrays.<Object[]> asList(new Object[] { "DE" }));
  }

  private HashedDictionary<ByteSpan> load(HashedDictionaryConfiguration config, Block block) throws LoadException {
    HashedDictionary<ByteSpan> res = new HashedDictionary<>("cities", STRUCTURE, KeyShape.COMPLEX,
        TestDictionarySource.of(block), config, executorManager);
    res.loadData();
    return res;
  }

  private Block cities() {
    return new Block(COLUMNS,
        Arrays.asList(new Object[] { "DE", "DE", "US" }, new Object[] { 80331L, 10115L, 10115L },
            new Object[] { "Munich", "Berlin", "New York" },
            new Object[] { 1_500_000L, 3_600_000L, 8_000_000L }));
  }
}
