package eu.okaeri.docengine.document;

import eu.okaeri.docengine.DatabaseException;
import lombok.Getter;

@Getter
public class ObjectNotFoundException extends DatabaseException {

    private final String model;

    public ObjectNotFoundException(String model) {
        super(model + " matching query does not exist.");
        this.model = model;
    }
}
