package eu.okaeri.docengine.collection;

/**
 * Hook applied to every collection handle a connection hands out, e.g. to record or instrument calls.
 */
@FunctionalInterface
public interface CollectionDecorator {

    CollectionDecorator NONE = collection -> collection;

    DocumentCollection decorate(DocumentCollection collection);

    default CollectionDecorator andThen(CollectionDecorator next) {
        return collection -> next.decorate(this.decorate(collection));
    }
}
