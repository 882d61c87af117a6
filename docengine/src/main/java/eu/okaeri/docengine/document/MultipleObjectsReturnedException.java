package eu.okaeri.docengine.document;

import eu.okaeri.docengine.DatabaseException;
import lombok.Getter;

@Getter
public class MultipleObjectsReturnedException extends DatabaseException {

    private final String model;

    public MultipleObjectsReturnedException(String model) {
        super("get() returned more than one " + model);
        this.model = model;
    }
}
