package pass.IRPass.analysis.dataflow;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense indexing of the finite domain a bit-vector analysis ranges over.
 */
public class Universe<T> {
    private final Map<T, Integer> index = new HashMap<>();
    private final List<T> elements = new ArrayList<>();

    public Universe() {
    }

    public Universe(Collection<T> initial) {
        initial.forEach(this::add);
    }

    /**
     * @return the index of {@code element}, registering it when new
     */
    public int add(T element) {
        Integer id = index.get(element);
        if (id != null) {
            return id;
        }
        index.put(element, elements.size());
        elements.add(element);
        return elements.size() - 1;
    }

    /**
     * @return the index of {@code element}, or -1 when unknown
     */
    public int indexOf(T element) {
        return index.getOrDefault(element, -1);
    }

    public boolean contains(T element) {
        return index.containsKey(element);
    }

    public T get(int i) {
        return elements.get(i);
    }

    public int size() {
        return elements.size();
    }

    public List<T> getElements() {
        return elements;
    }

    public BitSet setOf(Collection<T> members) {
        BitSet set = new BitSet(size());
        for (T member : members) {
            int id = indexOf(member);
            if (id >= 0) {
                set.set(id);
            }
        }
        return set;
    }

    public List<T> elementsOf(BitSet set) {
        List<T> result = new ArrayList<>();
        for (int i = set.nextSetBit(0); i >= 0; i = set.nextSetBit(i + 1)) {
            result.add(elements.get(i));
        }
        return result;
    }

    public BitSet all() {
        BitSet set = new BitSet(size());
        set.set(0, size());
        return set;
    }
}
