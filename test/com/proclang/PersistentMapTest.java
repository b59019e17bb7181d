package com.proclang;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class PersistentMapTest {

    @Test
    public void assocReturnsANewMapAndLeavesTheOriginal() {
        PersistentMap<String, Integer> empty = PersistentMap.empty();
        PersistentMap<String, Integer> one = empty.assoc("a", 1);
        PersistentMap<String, Integer> two = one.assoc("a", 2);

        assertThat(empty.get("a"), is(nullValue()));
        assertThat(one.get("a"), is(1));
        assertThat(two.get("a"), is(2));
        assertThat(two.size(), is(1));
    }

    @Test
    public void assocOfAnUnchangedEntryReturnsTheSameMap() {
        PersistentMap<String, Integer> map = PersistentMap.<String, Integer>empty().assoc("a", 1);

        assertThat(map.assoc("a", 1), is(sameInstance(map)));
    }

    @Test
    public void keysWithEqualHashCodesAreKeptApart() {
        assertThat("Aa".hashCode(), is("BB".hashCode()));

        PersistentMap<String, Integer> map = PersistentMap.<String, Integer>empty()
            .assoc("Aa", 1)
            .assoc("BB", 2)
            .assoc("AaAa", 3)
            .assoc("BBBB", 4)
            .assoc("AaBB", 5);

        assertThat(map.size(), is(5));
        assertThat(map.get("Aa"), is(1));
        assertThat(map.get("BB"), is(2));
        assertThat(map.get("AaAa"), is(3));
        assertThat(map.get("BBBB"), is(4));
        assertThat(map.get("AaBB"), is(5));
        assertThat(map.assoc("BB", 20).get("BB"), is(20));
        assertThat(map.assoc("BB", 20).get("Aa"), is(1));
    }

    @Test
    public void holdsManyKeys() {
        PersistentMap<String, Integer> map = PersistentMap.empty();
        Map<String, Integer> expected = new HashMap<>();

        for (int i = 0; i < 5000; i++) {
            map = map.assoc("k" + i, i);
            expected.put("k" + i, i);
        }

        assertThat(map.size(), is(5000));
        assertThat(map.toMap(), is(expected));
        for (int i = 0; i < 5000; i++) {
            assertThat(map.get("k" + i), is(i));
        }
        assertThat(map.get("missing"), is(nullValue()));
    }

    @Test
    public void equalityIgnoresInsertionOrder() {
        PersistentMap<String, Integer> first = PersistentMap.<String, Integer>empty().assoc("x", 1).assoc("y", 2);
        PersistentMap<String, Integer> second = PersistentMap.<String, Integer>empty().assoc("y", 2).assoc("x", 1);

        assertThat(first, is(second));
        assertThat(first.hashCode(), is(second.hashCode()));
        assertThat(first, is(not(second.assoc("x", 3))));
    }

    @Test
    public void sortedEntriesAreInKeyOrder() {
        PersistentMap<String, Integer> map = PersistentMap.<String, Integer>empty()
            .assoc("c", 3).assoc("a", 1).assoc("b", 2);

        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : map.getSortedEntries()) {
            keys.add(entry.getKey());
        }

        assertThat(keys, is(List.of("a", "b", "c")));
    }
}
