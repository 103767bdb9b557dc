package io.swarmhive.error;

public final class CellNotFoundException extends HiveException {
    private final String cellId;

    public CellNotFoundException(String cellId) {
        super("Cell not found: " + cellId);
        this.cellId = cellId;
    }

    public String cellId() {
        return cellId;
    }
}
