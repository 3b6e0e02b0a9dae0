package com.flamingo.ai.researchtwin.service.document;

import com.flamingo.ai.researchtwin.domain.enums.FileType;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.enums.SourceType;
import com.flamingo.ai.researchtwin.domain.model.DocumentMetadata;
import lombok.Builder;

/**
 * Request to ingest extracted document text into a namespace.
 *
 * @param namespaceId target namespace, required
 * @param fileName logical file name and replace key, required
 * @param fileType original format; inferred from the file name when absent
 * @param text extracted plain text
 * @param sourceType how the document arrived; defaults to upload
 * @param sourceRef origin locator, e.g. a URL
 * @param sourceRole explicit role; inferred from the file name when absent
 * @param metadata optional bibliographic metadata
 */
@Builder
public record IngestCommand(
    String namespaceId,
    String fileName,
    FileType fileType,
    String text,
    SourceType sourceType,
    String sourceRef,
    SourceRole sourceRole,
    DocumentMetadata metadata) {}
