package com.raditha.cildiff.model;


/**
 * A statement relating two names, such as {@code (roletype r t)},
 * {@code (typealiasactual alias actual)} or {@code (typebounds parent child)}.
 *
 * @param subject first name; the identity of the statement unless the flavor is a bounds statement
 * @param object  second name
 */
public record Association(String subject, String object) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
