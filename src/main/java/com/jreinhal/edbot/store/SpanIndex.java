package com.jreinhal.edbot.store;

import com.jreinhal.edbot.model.BBox;
import com.jreinhal.edbot.model.OffsetRange;
import org.springframework.lang.Nullable;

/**
 * Bounding boxes recorded at document-processing time.
 */
public interface SpanIndex {

    /**
     * @return the box covering the range, or null when the document was not rendered with geometry
     */
    @Nullable
    BBox bboxFor(String documentId, @Nullable Integer page, OffsetRange range);
}
