package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.config.RetrievalProperties;
import com.jreinhal.edbot.rag.classifier.QueryAnalyzer;
import com.jreinhal.edbot.rag.classifier.QueryClassifier;
import com.jreinhal.edbot.rag.scoring.CandidateSelector;
import com.jreinhal.edbot.rag.scoring.ConfidenceCalculator;
import com.jreinhal.edbot.rag.scoring.RelevanceScorer;
import com.jreinhal.edbot.rag.thesaurus.MedicalThesaurus;
import com.jreinhal.edbot.rag.thesaurus.ThesaurusFixtures;

/**
 * Real analyzer and scoring components over the bundled lexicon.
 */
final class TierFixtures {
    final MedicalThesaurus thesaurus = ThesaurusFixtures.bundled();
    final QueryAnalyzer analyzer = new QueryAnalyzer(new QueryClassifier(), thesaurus);
    final RelevanceScorer relevanceScorer = new RelevanceScorer(thesaurus);
    final ConfidenceCalculator confidenceCalculator = new ConfidenceCalculator(thesaurus);
    final RetrievalProperties properties = new RetrievalProperties();
    final CandidateSelector selector = new CandidateSelector(relevanceScorer, confidenceCalculator, properties);
}
