// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.util.collection;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.RandomAccess;
import java.util.function.Function;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * A {@link List} implementation that is guaranteed to be immutable, backed by a single array.
 * <p>
 * The immutability is shallow, so it's meant for element types that are immutable themselves, such as green syntax
 * elements. All mutating {@link List} methods throw {@link UnsupportedOperationException}; "modified" copies are
 * made with {@link #with(int, Object)} and {@link #splice(int, int, List)} instead, which copy the backing array and
 * share the elements.
 *
 * @param <T> the type of elements in this list
 */
public final class ImmutableList<T> extends AbstractList<T> implements RandomAccess {
    private ImmutableList(final Object[] items) {
        this.items = items;
    }

    /**
     * Returns an empty immutable list.
     */
    @SuppressWarnings("unchecked")
    public static <T> ImmutableList<T> empty() {
        return (ImmutableList<T>) EMPTY;
    }

    /**
     * Returns a new immutable list containing only the given element.
     */
    public static <T> ImmutableList<T> of(final T element) {
        return new ImmutableList<>(new Object[] {element});
    }

    /**
     * Returns a new immutable list containing the given elements, in order.
     */
    @SafeVarargs
    public static <T> ImmutableList<T> of(final T... elements) {
        return (elements.length == 0)
            ? empty()
            : new ImmutableList<>(Arrays.copyOf(elements, elements.length, Object[].class));
    }

    /**
     * Returns an immutable list with the same elements as the given collection, in iteration order. If the collection
     * already is an immutable list, it's returned as is.
     */
    @SuppressWarnings("unchecked")
    public static <T> ImmutableList<T> copyOf(final Collection<? extends T> collection) {
        if (collection instanceof ImmutableList<?> list) {
            return (ImmutableList<T>) list;
        }
        return collection.isEmpty() ? empty() : new ImmutableList<>(collection.toArray());
    }

    /**
     * Returns a new immutable list containing the results of applying {@code function} to each element of
     * {@code source}, in order.
     */
    public static <T, R> ImmutableList<R> map(
        final List<? extends T> source,
        final Function<? super T, ? extends R> function
    ) {
        final var size = source.size();
        if (size == 0) {
            return empty();
        }
        final var result = new Object[size];
        for (int i = 0; i < size; i += 1) {
            result[i] = function.apply(source.get(i));
        }
        return new ImmutableList<>(result);
    }

    @Override
    @SuppressWarnings("unchecked")
    public T get(final int index) {
        return (T) items[index];
    }

    @Override
    public int size() {
        return items.length;
    }

    /**
     * Returns a copy of this list with the element at {@code index} replaced by {@code element}.
     */
    @CheckReturnValue
    public ImmutableList<T> with(final int index, final T element) {
        final var copy = items.clone();
        copy[index] = element;
        return new ImmutableList<>(copy);
    }

    /**
     * Returns a copy of this list in which the elements in {@code [fromIndex, toIndex)} are replaced with the elements
     * of {@code replacement}.
     */
    @CheckReturnValue
    public ImmutableList<T> splice(final int fromIndex, final int toIndex, final List<? extends T> replacement) {
        if (fromIndex < 0 || toIndex > items.length || fromIndex > toIndex) {
            throw new IndexOutOfBoundsException(
                "Splice range " + fromIndex + ".." + toIndex + " out of bounds for size " + items.length);
        }
        final var replacementSize = replacement.size();
        final var result = new Object[items.length - (toIndex - fromIndex) + replacementSize];
        System.arraycopy(items, 0, result, 0, fromIndex);
        for (int i = 0; i < replacementSize; i += 1) {
            result[fromIndex + i] = replacement.get(i);
        }
        System.arraycopy(items, toIndex, result, fromIndex + replacementSize, items.length - toIndex);
        return (result.length == 0) ? empty() : new ImmutableList<>(result);
    }

    /**
     * Returns a new builder of immutable lists.
     */
    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    private static final ImmutableList<?> EMPTY = new ImmutableList<>(new Object[0]);

    private final Object[] items;

    /**
     * A builder of {@link ImmutableList}s: a growable array that is frozen into an immutable list once complete.
     *
     * @param <T> the type of elements in the resulting list
     */
    public static final class Builder<T> {
        private Builder() {
        }

        /**
         * Appends the given element.
         */
        public Builder<T> add(final T element) {
            if (size == items.length) {
                items = Arrays.copyOf(items, Math.max(8, size * 2));
            }
            items[size] = element;
            size += 1;
            return this;
        }

        /**
         * Appends all elements of the given collection, in iteration order.
         */
        public Builder<T> addAll(final Collection<? extends T> collection) {
            for (final var element : collection) {
                add(element);
            }
            return this;
        }

        public int size() {
            return size;
        }

        public boolean isEmpty() {
            return size == 0;
        }

        /**
         * Returns an immutable list of the elements added so far. The builder remains usable afterwards.
         */
        public ImmutableList<T> freeze() {
            return (size == 0) ? empty() : new ImmutableList<>(Arrays.copyOf(items, size));
        }

        private Object[] items = new Object[8];
        private int size = 0;
    }
}
