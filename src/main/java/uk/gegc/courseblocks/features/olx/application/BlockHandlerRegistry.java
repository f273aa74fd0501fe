package uk.gegc.courseblocks.features.olx.application;

import org.springframework.stereotype.Component;
import uk.gegc.courseblocks.shared.exception.UnsupportedBlockTypeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class BlockHandlerRegistry {

    private final Map<String, BlockXmlHandler> handlers = new LinkedHashMap<>();

    public BlockHandlerRegistry(List<BlockXmlHandler> handlers) {
        for (BlockXmlHandler handler : handlers) {
            BlockXmlHandler previous = this.handlers.putIfAbsent(handler.category(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for block type: " + handler.category());
            }
        }
    }

    public BlockXmlHandler getHandler(String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Block type is required");
        }
        BlockXmlHandler handler = handlers.get(category);
        if (handler == null) {
            throw new UnsupportedBlockTypeException("Unsupported block type: " + category);
        }
        return handler;
    }

    public boolean supports(String category) {
        return handlers.containsKey(category);
    }

    public Set<String> categories() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
