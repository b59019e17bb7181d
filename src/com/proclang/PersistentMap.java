package com.proclang;

import java.util.*;

public class PersistentMap<K, V> implements Iterable<Map.Entry<K, V>> {
    private static final int HASH_BITS = 5;
    private static final int HASH_MASK = (1 << HASH_BITS) - 1;

    private final Node<K, V> root;
    private final int count;

    private static final PersistentMap<?, ?> EMPTY = new PersistentMap<>(null, 0);

    private PersistentMap(Node<K, V> root, int count) {
        this.root = root;
        this.count = count;
    }

    @SuppressWarnings("unchecked")
    public static <K, V> PersistentMap<K, V> empty() {
        return (PersistentMap<K, V>) EMPTY;
    }

    public PersistentMap<K, V> assoc(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        int hash = key.hashCode();
        Node<K, V> newRoot = root == null ? new BitmapNode<>() : root;
        Node<K, V> result = newRoot.assoc(0, hash, key, value);

        if (result == root) {
            return this;
        }

        return new PersistentMap<>(result, containsKey(key) ? count : count + 1);
    }

    public V get(K key) {
        if (root == null || key == null) return null;
        return root.find(0, key.hashCode(), key);
    }

    public boolean containsKey(K key) {
        return get(key) != null;
    }

    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return new MapIterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PersistentMap)) return false;
        PersistentMap<?, ?> other = (PersistentMap<?, ?>) obj;
        if (count != other.count) return false;

        for (Map.Entry<K, V> entry : this) {
            @SuppressWarnings("unchecked")
            Object otherValue = ((PersistentMap<Object, Object>) other).get(entry.getKey());
            if (!Objects.equals(entry.getValue(), otherValue)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<K, V> entry : this) {
            hash += Objects.hashCode(entry.getKey()) ^ Objects.hashCode(entry.getValue());
        }
        return hash;
    }

    public Map<K, V> toMap() {
        Map<K, V> result = new LinkedHashMap<>();
        for (Map.Entry<K, V> entry : this) {
            result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    public List<Map.Entry<K, V>> getSortedEntries() {
        List<Map.Entry<K, V>> sorted = new ArrayList<>();
        for (Map.Entry<K, V> entry : this) {
            sorted.add(entry);
        }
        sorted.sort((a, b) -> compareKeys(a.getKey(), b.getKey()));
        return sorted;
    }

    @SuppressWarnings("unchecked")
    private int compareKeys(K a, K b) {
        if (a instanceof Comparable && a.getClass() == b.getClass()) {
            return ((Comparable<Object>) a).compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    private static int bitFor(int hash, int shift) {
        return 1 << ((hash >>> shift) & HASH_MASK);
    }

    private abstract static class Node<K, V> {
        abstract Node<K, V> assoc(int shift, int hash, K key, V value);
        abstract V find(int shift, int hash, K key);
        abstract void collectEntries(List<Map.Entry<K, V>> entries);
    }

    /**
     * Holds up to 32 slots selected by five bits of the hash. A slot is either a
     * key/value pair or, with a null key, a child node in the value position.
     */
    private static class BitmapNode<K, V> extends Node<K, V> {
        private final int bitmap;
        private final Object[] array;

        BitmapNode() {
            this.bitmap = 0;
            this.array = new Object[0];
        }

        BitmapNode(int bitmap, Object[] array) {
            this.bitmap = bitmap;
            this.array = array;
        }

        @Override
        @SuppressWarnings("unchecked")
        Node<K, V> assoc(int shift, int hash, K key, V value) {
            int bit = bitFor(hash, shift);
            int index = Integer.bitCount(bitmap & (bit - 1));
            int keyIndex = 2 * index;
            int valueIndex = keyIndex + 1;

            if ((bitmap & bit) == 0) {
                Object[] newArray = new Object[array.length + 2];
                System.arraycopy(array, 0, newArray, 0, keyIndex);
                newArray[keyIndex] = key;
                newArray[valueIndex] = value;
                System.arraycopy(array, keyIndex, newArray, keyIndex + 2, array.length - keyIndex);
                return new BitmapNode<>(bitmap | bit, newArray);
            }

            Object existingKey = array[keyIndex];
            Object existingValue = array[valueIndex];

            if (existingKey == null) {
                Node<K, V> child = (Node<K, V>) existingValue;
                Node<K, V> newChild = child.assoc(shift + HASH_BITS, hash, key, value);
                if (newChild == child) {
                    return this;
                }
                return withSlot(valueIndex, null, newChild);
            }

            if (existingKey.equals(key)) {
                if (Objects.equals(existingValue, value)) {
                    return this;
                }
                return withSlot(valueIndex, key, value);
            }

            Node<K, V> child = split(shift + HASH_BITS, (K) existingKey, (V) existingValue, hash, key, value);
            return withSlot(valueIndex, null, child);
        }

        private BitmapNode<K, V> withSlot(int valueIndex, Object key, Object value) {
            Object[] newArray = array.clone();
            newArray[valueIndex - 1] = key;
            newArray[valueIndex] = value;
            return new BitmapNode<>(bitmap, newArray);
        }

        private static <K, V> Node<K, V> split(int shift, K key1, V value1, int hash2, K key2, V value2) {
            int hash1 = key1.hashCode();
            if (hash1 == hash2) {
                return new CollisionNode<>(hash1, new Object[] {key1, value1, key2, value2});
            }
            return new BitmapNode<K, V>()
                .assoc(shift, hash1, key1, value1)
                .assoc(shift, hash2, key2, value2);
        }

        @Override
        @SuppressWarnings("unchecked")
        V find(int shift, int hash, K key) {
            int bit = bitFor(hash, shift);
            if ((bitmap & bit) == 0) {
                return null;
            }

            int keyIndex = 2 * Integer.bitCount(bitmap & (bit - 1));
            Object existingKey = array[keyIndex];

            if (existingKey == null) {
                return ((Node<K, V>) array[keyIndex + 1]).find(shift + HASH_BITS, hash, key);
            }

            if (existingKey.equals(key)) {
                return (V) array[keyIndex + 1];
            }

            return null;
        }

        @Override
        @SuppressWarnings("unchecked")
        void collectEntries(List<Map.Entry<K, V>> entries) {
            for (int i = 0; i < array.length; i += 2) {
                if (array[i] == null) {
                    ((Node<K, V>) array[i + 1]).collectEntries(entries);
                } else {
                    entries.add(new AbstractMap.SimpleImmutableEntry<>((K) array[i], (V) array[i + 1]));
                }
            }
        }
    }

    /** Keys whose full 32-bit hashes are equal, e.g. "Aa" and "BB". */
    private static class CollisionNode<K, V> extends Node<K, V> {
        private final int hash;
        private final Object[] array;

        CollisionNode(int hash, Object[] array) {
            this.hash = hash;
            this.array = array;
        }

        @Override
        Node<K, V> assoc(int shift, int hash, K key, V value) {
            if (hash != this.hash) {
                BitmapNode<K, V> parent = new BitmapNode<>(bitFor(this.hash, shift), new Object[] {null, this});
                return parent.assoc(shift, hash, key, value);
            }

            for (int i = 0; i < array.length; i += 2) {
                if (array[i].equals(key)) {
                    if (Objects.equals(array[i + 1], value)) {
                        return this;
                    }
                    Object[] newArray = array.clone();
                    newArray[i + 1] = value;
                    return new CollisionNode<>(hash, newArray);
                }
            }

            Object[] newArray = Arrays.copyOf(array, array.length + 2);
            newArray[array.length] = key;
            newArray[array.length + 1] = value;
            return new CollisionNode<>(hash, newArray);
        }

        @Override
        @SuppressWarnings("unchecked")
        V find(int shift, int hash, K key) {
            if (hash != this.hash) {
                return null;
            }
            for (int i = 0; i < array.length; i += 2) {
                if (array[i].equals(key)) {
                    return (V) array[i + 1];
                }
            }
            return null;
        }

        @Override
        @SuppressWarnings("unchecked")
        void collectEntries(List<Map.Entry<K, V>> entries) {
            for (int i = 0; i < array.length; i += 2) {
                entries.add(new AbstractMap.SimpleImmutableEntry<>((K) array[i], (V) array[i + 1]));
            }
        }
    }

    private class MapIterator implements Iterator<Map.Entry<K, V>> {
        private final List<Map.Entry<K, V>> entries;
        private int index = 0;

        MapIterator() {
            this.entries = new ArrayList<>();
            if (root != null) {
                root.collectEntries(entries);
            }
        }

        @Override
        public boolean hasNext() {
            return index < entries.size();
        }

        @Override
        public Map.Entry<K, V> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return entries.get(index++);
        }
    }
}
