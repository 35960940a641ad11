package io.kubecache.k8s.client;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Iterator;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import io.kubernetes.client.openapi.ApiException;

/**
 * Flattens a chain of list pages into one iterable. The next page is fetched once the previous one is handed out.
 */
class ResourceListIterable<T> implements Iterable<T> {
    interface Page<T> {
        Collection<T> items();

        @Nullable
        Page<T> nextPage() throws ApiException;
    }

    private final Page<T> firstPage;

    ResourceListIterable(final Page<T> firstPage) {
        this.firstPage = firstPage;
    }

    @Override
    public Iterator<T> iterator() {
        return Iterators.concat(new AbstractIterator<Iterator<T>>() {
            Page<T> currentPage = firstPage;

            @Override
            protected Iterator<T> computeNext() {
                if (currentPage == null)
                    return endOfData();

                final Iterator<T> iterator = currentPage.items().iterator();

                try {
                    currentPage = currentPage.nextPage();

                } catch (final ApiException e) {
                    throw new UncheckedApiException(e);
                }

                return iterator;
            }
        });
    }
}
