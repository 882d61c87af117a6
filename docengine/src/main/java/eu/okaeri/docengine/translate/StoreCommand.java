package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.collection.DocumentCollection;

/**
 * Native command produced by the {@link QueryTranslator}, ready to run against a collection.
 *
 * @param <R> result of the command
 */
public interface StoreCommand<R> {

    QueryKind getKind();

    R execute(DocumentCollection collection);
}
