package com.raditha.cildiff.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.raditha.cildiff.compare.ComparableNode;
import com.raditha.cildiff.diff.Diff;
import com.raditha.cildiff.diff.DiffTree;
import com.raditha.cildiff.diff.DiffTreeNode;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the diff tree as a single JSON document mirroring its structure.
 */
public class JsonDiffRenderer implements DiffRenderer {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final CilJsonWriter cilWriter = new CilJsonWriter();
    private final ValueChangeDescriber describer;
    private final boolean pretty;

    public record NodeDTO(String flavor, int line, String hash) {}

    public record DiffDTO(String side, String hash, String description, JsonNode node) {}

    public record DiffTreeDTO(NodeDTO left, NodeDTO right, List<DiffDTO> diffs, List<DiffTreeDTO> children) {}

    /**
     * @param pretty    indent the output
     * @param describer describes same-identity value changes, or null to skip descriptions
     */
    public JsonDiffRenderer(boolean pretty, ValueChangeDescriber describer) {
        this.pretty = pretty;
        this.describer = describer;
    }

    @Override
    public void render(DiffTree tree, Writer out) throws IOException {
        ObjectWriter objectWriter = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        out.write(objectWriter.writeValueAsString(toDTO(tree.getRoot())));
        out.write("\n");
        out.flush();
    }

    DiffTreeDTO toDTO(DiffTreeNode node) {
        Map<Diff, String> descriptions = describer != null ? describer.describe(node) : Map.of();
        List<DiffDTO> diffs = new ArrayList<>();
        for (Diff diff : node.getDiffs()) {
            String description = diff.description() != null ? diff.description() : descriptions.get(diff);
            diffs.add(new DiffDTO(diff.side().name(), diff.node().getFullHash().toHex(), description,
                    cilWriter.toJson(diff.node().getNode())));
        }
        List<DiffTreeDTO> children = new ArrayList<>();
        for (DiffTreeNode child : node.getChildren()) {
            children.add(toDTO(child));
        }
        return new DiffTreeDTO(toNodeDTO(node.getLeft()), toNodeDTO(node.getRight()), diffs, children);
    }

    private static NodeDTO toNodeDTO(ComparableNode node) {
        if (node == null) {
            return null;
        }
        return new NodeDTO(node.getFlavor().getTag(), node.getNode().getLine(), node.getFullHash().toHex());
    }
}
