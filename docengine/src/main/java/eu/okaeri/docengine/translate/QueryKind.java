package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.connection.OperationKind;

import java.util.Optional;

public enum QueryKind {

    READ(null),
    COUNT(null),
    SAVE(OperationKind.SAVE),
    UPDATE_MULTI(OperationKind.UPDATE),
    DELETE(OperationKind.REMOVE);

    private final OperationKind operation;

    QueryKind(OperationKind operation) {
        this.operation = operation;
    }

    /**
     * Write operation whose flags the command carries, empty for reads.
     */
    public Optional<OperationKind> getOperation() {
        return Optional.ofNullable(this.operation);
    }
}
