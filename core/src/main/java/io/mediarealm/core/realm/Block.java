package io.mediarealm.core.realm;

import java.util.Objects;

/**
 * One unit of content on a realm. {@code index} is dense and zero-based
 * within the owning realm.
 */
public record Block(long id, long realmId, int index, BlockContent content) {

    public Block {
        Objects.requireNonNull(content, "content");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }

    public BlockKind kind() {
        return content.kind();
    }

    public Block atIndex(int newIndex) {
        return new Block(id, realmId, newIndex, content);
    }

    public Block withContent(BlockContent newContent) {
        return new Block(id, realmId, index, newContent);
    }
}
