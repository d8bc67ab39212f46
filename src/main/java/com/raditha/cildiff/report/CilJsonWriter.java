package com.raditha.cildiff.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.cildiff.model.CilNode;

/**
 * Converts CIL statements into JSON trees.
 * <p>
 * A statement becomes an object with its {@code flavor} and {@code line}, the fields of its
 * payload record, and a {@code children} array for containers. References are written as
 * the referenced name or as the inline object.
 */
public class CilJsonWriter {

    private final ObjectMapper mapper = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public ObjectNode toJson(CilNode node) {
        ObjectNode json = mapper.createObjectNode();
        json.put("flavor", node.getFlavor().getTag());
        json.put("line", node.getLine());
        ObjectNode fields = mapper.valueToTree(node.getData());
        json.setAll(fields);
        if (node.getFlavor().isContainer()) {
            ArrayNode children = json.putArray("children");
            for (CilNode child : node.getChildren()) {
                children.add(toJson(child));
            }
        }
        return json;
    }
}
