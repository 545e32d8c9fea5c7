package ca.jonathanfritz.zkbcat.secure;

import ca.jonathanfritz.zkbcat.exception.ZkbCatException;

import java.nio.file.Path;

/**
 * Just like a {@link java.util.function.Function}, except that it consumes the path of a staged document and its
 * {@link #apply(Path)} method can throw an instance of {@link ZkbCatException}
 * @param <T> the type of object that will be returned by the {@link #apply(Path)} method
 */
@FunctionalInterface
public interface StagedDocumentFunction<T> {
    T apply(Path stagedPath) throws ZkbCatException;
}
