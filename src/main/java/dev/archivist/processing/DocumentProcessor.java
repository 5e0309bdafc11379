package dev.archivist.processing;

import dev.archivist.metadata.SourceType;
import dev.archivist.store.BatchHandle;
import dev.archivist.store.BatchManifest;
import dev.archivist.store.ContentKind;
import dev.archivist.store.MalformedBatchException;
import dev.archivist.store.ManifestEntry;
import dev.archivist.store.RawDataStore;
import dev.archivist.store.StoredDocument;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one stored batch into chunked, provenance-carrying text units.
 *
 * <p>The batch's declared source type selects a {@link DocumentRenderer} from a strategy table
 * built at construction. Each member is rendered and split independently; a member that cannot be
 * read or rendered becomes a failed {@link ProcessedDocument} and the rest of the batch proceeds.
 * Binary members are audit copies of uploads and are not rendered.
 */
@Service
public class DocumentProcessor {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);

    private final RawDataStore store;
    private final RecursiveTextSplitter splitter;
    private final Map<SourceType, DocumentRenderer> renderers = new EnumMap<>(SourceType.class);

    public DocumentProcessor(RawDataStore store,
                             RecursiveTextSplitter splitter,
                             List<DocumentRenderer> renderers) {
        this.store = store;
        this.splitter = splitter;
        for (DocumentRenderer renderer : renderers) {
            for (SourceType type : renderer.sourceTypes()) {
                DocumentRenderer previous = this.renderers.put(type, renderer);
                if (previous != null) {
                    throw new IllegalStateException("Two renderers registered for " + type.value()
                            + ": " + previous.getClass().getSimpleName() + ", "
                            + renderer.getClass().getSimpleName());
                }
            }
        }
    }

    /**
     * Processes every non-binary member of a batch.
     *
     * @param handle the batch to process
     * @return one outcome per member
     * @throws dev.archivist.store.BatchNotFoundException if the batch does not exist
     * @throws MalformedBatchException if the manifest is missing or unreadable, or no renderer
     *                                 exists for the batch's source type
     */
    public BatchProcessingResult processBatch(BatchHandle handle) {
        BatchManifest manifest = store.readManifest(handle);
        DocumentRenderer renderer = renderers.get(manifest.sourceType());
        if (renderer == null) {
            throw new MalformedBatchException("No renderer for source type "
                    + manifest.sourceType().value() + " in batch " + handle);
        }

        List<ProcessedDocument> outcomes = new ArrayList<>();
        for (ManifestEntry entry : manifest.documents()) {
            if (entry.contentKind() == ContentKind.BINARY) {
                continue;
            }
            outcomes.add(processDocument(handle, entry, renderer));
        }

        BatchProcessingResult result = new BatchProcessingResult(handle, outcomes);
        log.info("Processed batch {}: {} documents, {} failed, {} chunks",
                handle, outcomes.size(), result.failed(), result.chunks().size());
        return result;
    }

    private ProcessedDocument processDocument(BatchHandle handle, ManifestEntry entry,
                                              DocumentRenderer renderer) {
        String text;
        StoredDocument document;
        try {
            document = store.readDocument(handle, entry);
            text = renderer.render(document);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to process document {} in batch {}", entry.id(), handle, e);
            return ProcessedDocument.failure(entry.id(), e.getClass().getSimpleName() + ": "
                    + e.getMessage());
        }

        List<String> pieces = splitter.split(text.strip());
        List<DocumentChunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            chunks.add(new DocumentChunk(pieces.get(i), document.metadata(), handle.toString(),
                    entry.id(), i, pieces.size()));
        }
        log.debug("Document {} -> {} chunks", entry.id(), chunks.size());
        return ProcessedDocument.success(entry.id(), chunks);
    }
}
