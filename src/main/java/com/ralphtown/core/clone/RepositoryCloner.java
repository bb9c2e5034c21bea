package com.ralphtown.core.clone;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Blocking clone of a remote repository into a local directory.
 */
public interface RepositoryCloner {

    /**
     * Clones {@code url} into {@code destination}, blocking until done.
     *
     * @param progress receives progress snapshots on the cloning thread; must not block
     * @throws CloneException with a classified failure if the clone does not succeed
     */
    void clone(String url, Path destination, Consumer<CloneProgress> progress) throws CloneException;
}
