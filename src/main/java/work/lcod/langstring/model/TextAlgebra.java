package work.lcod.langstring.model;

import java.util.List;
import java.util.Map;

/**
 * String-like operations whose results keep the language tag of the receiver.
 *
 * @param <T> the tagged text type
 */
public interface TextAlgebra<T extends TextAlgebra<T>> {
    T concat(T other);

    T concat(String other);

    T repeat(int times);

    T charAt(int index);

    T slice(Integer start, Integer end, Integer step);

    T capitalize();

    T casefold();

    T lower();

    T upper();

    T swapcase();

    T title();

    T center(int width, char fill);

    T ljust(int width, char fill);

    T rjust(int width, char fill);

    T zfill(int width);

    T expandtabs(int tabSize);

    T strip(String chars);

    T lstrip(String chars);

    T rstrip(String chars);

    T removePrefix(String prefix);

    T removeSuffix(String suffix);

    T replace(String old, String replacement, int count);

    T translate(Map<Integer, String> table);

    T join(Iterable<?> parts);

    T format(Object... args);

    T formatMap(Map<String, ?> values);

    List<T> split(String separator, int maxSplit);

    List<T> rsplit(String separator, int maxSplit);

    List<T> splitlines(boolean keepEnds);

    List<T> partition(String separator);

    List<T> rpartition(String separator);
}
