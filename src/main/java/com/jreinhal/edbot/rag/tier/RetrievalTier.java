package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;

/**
 * One retrieval strategy of the answer cascade.
 *
 * <p>Implementations return at most one candidate, their internally best-scored one, and report
 * store faults as {@link TierResult#failure(TierError)} rather than throwing. They check
 * {@link RetrievalContext#shouldStop()} between sub-steps.</p>
 */
public interface RetrievalTier {

    Tier tier();

    TierResult retrieve(Query query, RetrievalContext context);
}
