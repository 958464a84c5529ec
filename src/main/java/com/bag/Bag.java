package com.bag;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.RandomAccess;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An unordered, non-unique collection of values, where every insertion is
 * addressed by a {@link Token} rather than by the value itself.
 *
 * <h2>Overview</h2>
 * Observer registries need to cancel "exactly this registration" without
 * asking the registered callbacks to implement {@code equals}/{@code hashCode}.
 * {@link #insert(Object)} hands back a token minted from a per-instance
 * counter, and {@link #remove(Token)} deletes the entry carrying that token.
 * The same value may be inserted any number of times; each insertion gets its
 * own token.
 *
 * <h2>Storage</h2>
 * Elements and tokens live in two index-aligned lists. Removal shifts the
 * entries after the removed one, so the surviving entries always iterate in
 * insertion order.
 *
 * <h2>Thread Safety</h2>
 * This class is <b>not</b> synchronized. Callers that share a bag between
 * threads must serialize every access with an external lock, or confine the
 * bag to a single owner.
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Bag&lt;Runnable&gt; observers = new Bag&lt;&gt;();
 * Bag.Token token = observers.insert(() -&gt; System.out.println("fired"));
 *
 * for (Runnable observer : observers) {
 *     observer.run();
 * }
 *
 * observers.remove(token);
 * observers.remove(token); // no-op
 * </pre>
 *
 * @param <E> the type of elements held in this bag
 */
public class Bag<E> implements Iterable<E>, RandomAccess {

    /**
     * A uniquely identifying handle for removing a value that was inserted
     * into a {@link Bag}. Only a bag can mint one. Tokens compare by
     * identity, so a token from another bag never matches.
     */
    public static final class Token {

        private final long value;

        private Token(long value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return "Token(" + value + ")";
        }
    }

    private final List<E> elements;
    private final List<Token> tokens;

    /** Value of the next token to mint. Never decreases. */
    private long nextToken;

    public Bag() {
        this.elements = new ArrayList<>();
        this.tokens = new ArrayList<>();
    }

    /**
     * Creates an empty bag with room for {@code initialCapacity} entries.
     *
     * @param initialCapacity number of entries to presize storage for
     * @throws IllegalArgumentException if initialCapacity is negative
     */
    public Bag(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Initial capacity cannot be negative: " + initialCapacity);
        }
        this.elements = new ArrayList<>(initialCapacity);
        this.tokens = new ArrayList<>(initialCapacity);
    }

    /**
     * Creates a copy of {@code other}. The copy holds the same entries under
     * the same tokens and continues minting from the same counter value, but
     * shares no mutable state with {@code other}.
     *
     * @param other the bag to copy
     * @throws NullPointerException if other is null
     */
    public Bag(Bag<? extends E> other) {
        this.elements = new ArrayList<>(other.elements);
        this.tokens = new ArrayList<>(other.tokens);
        this.nextToken = other.nextToken;
    }

    /**
     * Inserts the given value and returns a token that can later be passed to
     * {@link #remove(Token)}.
     *
     * @param value the value to insert, may be null
     * @return a token distinct from every other token this bag has issued
     */
    public Token insert(E value) {
        // A long counter will not wrap within any realistic uptime.
        Token token = new Token(nextToken++);

        elements.add(value);
        tokens.add(token);

        return token;
    }

    /**
     * Removes the value inserted under the given token. If that value has
     * already been removed, or the token was never issued by this bag,
     * nothing happens.
     *
     * @param token a token returned from {@link #insert(Object)}
     */
    public void remove(Token token) {
        // Newest first: short-lived registrations are the common case.
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i) == token) {
                tokens.remove(i);
                elements.remove(i);
                return;
            }
        }
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /** Index of the first element. Always zero. */
    public int startIndex() {
        return 0;
    }

    /** One past the index of the last element, i.e. {@link #size()}. */
    public int endIndex() {
        return elements.size();
    }

    /**
     * Returns the element at the given position in insertion order.
     *
     * @throws IndexOutOfBoundsException if index is outside [startIndex, endIndex)
     */
    public E get(int index) {
        if (index < 0 || index >= elements.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + elements.size());
        }
        return elements.get(index);
    }

    /**
     * Returns an iterator over the elements present when this method is
     * called, in insertion order. Each call starts a fresh traversal.
     * Mutating the bag before the iterator is exhausted leaves its results
     * undefined.
     *
     * @return an iterator over this bag's elements
     */
    @Override
    public Iterator<E> iterator() {
        return new BagIterator();
    }

    /**
     * Returns a sequential stream over this bag's elements, in insertion order.
     */
    public Stream<E> stream() {
        return StreamSupport.stream(
            Spliterators.spliterator(iterator(), size(), Spliterator.ORDERED | Spliterator.SIZED),
            false);
    }

    @Override
    public String toString() {
        return elements.toString();
    }

    private class BagIterator implements Iterator<E> {
        private final int endIndex = elements.size();
        private int nextIndex = 0;

        @Override
        public boolean hasNext() {
            return nextIndex < endIndex && nextIndex < elements.size();
        }

        @Override
        public E next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return elements.get(nextIndex++);
        }
    }
}
