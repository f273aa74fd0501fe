package uk.gegc.courseblocks.features.olx.application.impl;

import lombok.RequiredArgsConstructor;
import org.dom4j.Element;
import org.springframework.stereotype.Service;
import uk.gegc.courseblocks.features.olx.application.BlockExporter;
import uk.gegc.courseblocks.features.olx.application.BlockHandlerRegistry;
import uk.gegc.courseblocks.features.olx.application.OlxExportService;
import uk.gegc.courseblocks.features.olx.application.OlxXml;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.runtime.BlockRuntime;
import uk.gegc.courseblocks.shared.exception.ContentExportException;

import java.io.IOException;

@Service("olxExportService")
@RequiredArgsConstructor
public class OlxExportServiceImpl implements OlxExportService {

    private final BlockHandlerRegistry handlerRegistry;
    private final BlockExporter blockExporter;

    @Override
    public Element exportBlock(Block block, BlockRuntime runtime) {
        Element node = OlxXml.createElement(block.getCategory());
        exportBlock(block, node, runtime);
        return node;
    }

    @Override
    public void exportBlock(Block block, Element node, BlockRuntime runtime) {
        blockExporter.addXmlToNode(block, handlerRegistry.getHandler(block.getCategory()), node, runtime);
    }

    @Override
    public String exportToString(Block block, BlockRuntime runtime) {
        Element node = exportBlock(block, runtime);
        try {
            return OlxXml.toXmlString(node);
        } catch (IOException e) {
            throw new ContentExportException("Failed to render " + block.getCategory() + " block " + block.getUrlName(), e);
        }
    }
}
