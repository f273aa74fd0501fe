package uk.gegc.courseblocks.features.olx.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.springframework.stereotype.Service;
import uk.gegc.courseblocks.features.olx.application.BlockHandlerRegistry;
import uk.gegc.courseblocks.features.olx.application.BlockMaterializer;
import uk.gegc.courseblocks.features.olx.application.BlockXmlHandler;
import uk.gegc.courseblocks.features.olx.application.DefinitionLoader;
import uk.gegc.courseblocks.features.olx.application.MetadataMerger;
import uk.gegc.courseblocks.features.olx.application.OlxImportService;
import uk.gegc.courseblocks.features.olx.application.OlxXml;
import uk.gegc.courseblocks.features.olx.application.PointerTags;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.BlockMetadata;
import uk.gegc.courseblocks.features.olx.domain.model.DefinitionKey;
import uk.gegc.courseblocks.features.olx.domain.model.LoadedDefinition;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;
import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;
import uk.gegc.courseblocks.features.olx.domain.runtime.BlockRuntime;
import uk.gegc.courseblocks.shared.exception.InvalidDefinitionException;

@Service("olxImportService")
@RequiredArgsConstructor
@Slf4j
public class OlxImportServiceImpl implements OlxImportService {

    private final BlockHandlerRegistry handlerRegistry;
    private final DefinitionLoader definitionLoader;
    private final MetadataMerger metadataMerger;
    private final BlockMaterializer blockMaterializer;

    @Override
    public Block importBlock(Element node, BlockRuntime runtime) {
        return importBlock(node, runtime, null);
    }

    @Override
    public Block importBlock(Element node, BlockRuntime runtime, ScopeIds keys) {
        BlockXmlHandler handler = handlerRegistry.getHandler(node.getName());
        ScopeIds scopeIds = keys != null ? keys : createKeys(node, runtime);

        // Step 1: definition, following pointers and legacy filename references
        LoadedDefinition loaded = definitionLoader.load(node, handler, runtime, scopeIds);

        // Step 2: settings, lowest to highest precedence
        BlockMetadata metadata = metadataMerger.loadMetadata(loaded.definitionXml(), handler.schema());
        String definitionMetadata = loaded.definition().getDefinitionMetadata();
        if (definitionMetadata != null) {
            metadataMerger.applyDefinitionMetadata(metadata, definitionMetadata);
        }
        metadataMerger.applyPolicy(metadata, runtime.getPolicy(scopeIds.usageId()), handler.schema());

        // Step 3: block
        Block block = blockMaterializer.materialize(handler, runtime, scopeIds, metadata, loaded);
        log.debug("Imported {} block {}", block.getCategory(), block.getLocation());
        return block;
    }

    @Override
    public Block importBlock(String xml, BlockRuntime runtime) {
        Element node;
        try {
            node = OlxXml.parse(xml);
        } catch (DocumentException e) {
            throw new InvalidDefinitionException("Malformed OLX: " + e.getMessage(), e);
        }
        return importBlock(node, runtime);
    }

    private ScopeIds createKeys(Element node, BlockRuntime runtime) {
        String urlName = node.attributeValue(PointerTags.URL_NAME);
        DefinitionKey definitionId = runtime.idGenerator().createDefinition(node.getName(), urlName);
        UsageKey usageId = runtime.idGenerator().createUsage(definitionId);
        return new ScopeIds(null, node.getName(), definitionId, usageId);
    }
}
