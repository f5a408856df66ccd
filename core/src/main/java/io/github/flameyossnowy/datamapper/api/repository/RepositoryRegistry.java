package io.github.flameyossnowy.datamapper.api.repository;

import io.github.flameyossnowy.datamapper.api.adapter.Adapter;
import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Repositories known to one application, by name.
 */
public final class RepositoryRegistry implements AutoCloseable {
    private final Map<String, Repository> repositories = new LinkedHashMap<>(2);

    public synchronized Repository register(@NotNull Adapter adapter) {
        Repository repository = new Repository(adapter);
        Repository previous = repositories.put(repository.name(), repository);
        if (previous != null) {
            Logging.warn("Replacing repository '" + repository.name() + "'");
        }
        return repository;
    }

    /**
     * @throws IllegalArgumentException when no repository has that name
     */
    public synchronized @NotNull Repository get(@NotNull String name) {
        Repository repository = repositories.get(name);
        if (repository == null) {
            throw new IllegalArgumentException("Unknown repository '" + name + "', known are " + repositories.keySet());
        }
        return repository;
    }

    public Repository defaultRepository() {
        return get(Model.DEFAULT_REPOSITORY);
    }

    public synchronized boolean contains(@NotNull String name) {
        return repositories.containsKey(name);
    }

    public synchronized Collection<Repository> repositories() {
        return Collections.unmodifiableCollection(repositories.values());
    }

    @Override
    public synchronized void close() {
        for (Repository repository : repositories.values()) repository.close();
        repositories.clear();
    }
}
