package io.github.flameyossnowy.datamapper.api;

import java.util.Iterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A single-pass iterator over resources that holds repository resources until it is
 * exhausted or closed.
 *
 * @param <T> element type
 */
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {
    @Override
    void close();

    /** A sequential stream over the remaining elements that closes this iterator when closed. */
    default Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, 0), false)
            .onClose(this::close);
    }

    static <T> CloseableIterator<T> of(Iterator<T> iterator) {
        return new CloseableIterator<>() {
            @Override
            public void close() {
            }

            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public T next() {
                return iterator.next();
            }
        };
    }
}
