package com.acme.finops.fieldpath.tree;

public class FieldWriteException extends Exception {
    private final WriteErrorCode code;
    private final int keyIndex;

    /**
     * @param keyIndex index of the path key where the write stopped, {@code -1} for the root
     */
    public FieldWriteException(WriteErrorCode code, int keyIndex, String message) {
        super(message);
        this.code = code;
        this.keyIndex = keyIndex;
    }

    public WriteErrorCode code() { return code; }
    public int keyIndex() { return keyIndex; }
}
