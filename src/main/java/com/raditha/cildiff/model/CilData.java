package com.raditha.cildiff.model;

/**
 * Payload of a CIL statement. Each implementation is an immutable record.
 */
public interface CilData {

    <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor);
}
