package work.lcod.langstring.model;

import java.util.Collection;

/**
 * Set operations between same-language collections. Raw string collections carry no language and are
 * accepted as operands as well.
 *
 * @param <T> the tagged collection type
 */
public interface SetAlgebra<T extends SetAlgebra<T>> {
    T union(T other);

    T union(Collection<String> other);

    T intersection(T other);

    T intersection(Collection<String> other);

    T difference(T other);

    T difference(Collection<String> other);

    T symmetricDifference(T other);

    T symmetricDifference(Collection<String> other);

    void unionUpdate(T other);

    void intersectionUpdate(T other);

    void differenceUpdate(T other);

    void symmetricDifferenceUpdate(T other);

    boolean isSubset(T other);

    boolean isSuperset(T other);

    boolean isProperSubset(T other);

    boolean isProperSuperset(T other);

    boolean isDisjoint(T other);
}
