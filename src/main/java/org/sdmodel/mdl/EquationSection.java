package org.sdmodel.mdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The part of a model description before the sketch marker.
 *
 * Holds the equation blocks both in declaration order and keyed by name, the lines
 * between blocks ({@code {UTF-8}}, blank lines, group headers) in their original
 * positions, and the control-parameter block as an opaque tail.
 */
public final class EquationSection {

    /**
     * An element of the equation section in source order.
     */
    public sealed interface Entry permits BlockEntry, LooseLine {
        List<String> lines();
    }

    public record BlockEntry(EquationBlock block) implements Entry {
        @Override
        public List<String> lines() {
            return block.toLines();
        }
    }

    public record LooseLine(String text) implements Entry {
        @Override
        public List<String> lines() {
            return List.of(text);
        }
    }

    private final List<Entry> entries;
    private final Map<String, EquationBlock> blocksByName = new LinkedHashMap<>();
    private final List<String> controlBlock;
    private int nextDeclarationOrder;

    public EquationSection(List<Entry> entries, List<String> controlBlock) {
        this.entries = new ArrayList<>(entries);
        this.controlBlock = List.copyOf(controlBlock);
        for (Entry entry : entries) {
            if (entry instanceof BlockEntry be) {
                // first definition wins, later duplicates stay in the text only
                blocksByName.putIfAbsent(VariableNames.canonical(be.block().name()), be.block());
                nextDeclarationOrder = Math.max(nextDeclarationOrder, be.block().declarationOrder() + 1);
            }
        }
    }

    // ==================== Queries ====================

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<String> controlBlock() {
        return controlBlock;
    }

    public Optional<EquationBlock> block(String name) {
        return Optional.ofNullable(blocksByName.get(VariableNames.canonical(name)));
    }

    public boolean hasBlock(String name) {
        return blocksByName.containsKey(VariableNames.canonical(name));
    }

    /**
     * Blocks in declaration order.
     */
    public List<EquationBlock> blocks() {
        List<EquationBlock> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry instanceof BlockEntry be) {
                result.add(be.block());
            }
        }
        return result;
    }

    public int nextDeclarationOrder() {
        return nextDeclarationOrder;
    }

    // ==================== Mutation ====================

    /**
     * Append a block after the last existing block, ahead of any trailing loose lines.
     */
    public void addBlock(EquationBlock block) {
        int insertAt = entries.size();
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i) instanceof BlockEntry) {
                insertAt = i + 1;
                break;
            }
        }
        entries.add(insertAt, new BlockEntry(block));
        blocksByName.put(VariableNames.canonical(block.name()), block);
        nextDeclarationOrder = Math.max(nextDeclarationOrder, block.declarationOrder() + 1);
    }

    /**
     * Remove every block defining the name. Returns whether anything was removed.
     */
    public boolean removeBlock(String name) {
        String key = VariableNames.canonical(name);
        boolean removed = entries.removeIf(e -> e instanceof BlockEntry be
                && VariableNames.canonical(be.block().name()).equals(key));
        blocksByName.remove(key);
        return removed;
    }

    /**
     * Replace the block that defines the same name, keeping its position.
     */
    public void replaceBlock(EquationBlock block) {
        String key = VariableNames.canonical(block.name());
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) instanceof BlockEntry be && VariableNames.canonical(be.block().name()).equals(key)) {
                entries.set(i, new BlockEntry(block));
                blocksByName.put(key, block);
                return;
            }
        }
        addBlock(block);
    }

    // ==================== Rendering ====================

    public List<String> toLines() {
        List<String> lines = new ArrayList<>();
        for (Entry entry : entries) {
            lines.addAll(entry.lines());
        }
        lines.addAll(controlBlock);
        return lines;
    }
}
