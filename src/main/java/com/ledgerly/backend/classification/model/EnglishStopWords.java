package com.ledgerly.backend.classification.model;

import java.util.Set;

final class EnglishStopWords {

    private EnglishStopWords() {}

    static final Set<String> WORDS = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "almost", "alone", "along",
            "already", "also", "although", "always", "am", "among", "an", "and", "another", "any",
            "anyone", "anything", "anywhere", "are", "around", "as", "at", "back", "be", "became",
            "because", "become", "been", "before", "being", "below", "beside", "between", "beyond",
            "both", "but", "by", "can", "cannot", "could", "did", "do", "does", "done", "down",
            "during", "each", "either", "else", "enough", "etc", "even", "ever", "every", "few",
            "for", "from", "further", "get", "give", "go", "had", "has", "have", "he", "her", "here",
            "hers", "herself", "him", "himself", "his", "how", "however", "if", "in", "into", "is",
            "it", "its", "itself", "just", "last", "least", "less", "many", "may", "me", "might",
            "more", "most", "much", "must", "my", "myself", "neither", "never", "no", "nobody",
            "none", "nor", "not", "nothing", "now", "of", "off", "often", "on", "once", "one",
            "only", "onto", "or", "other", "others", "otherwise", "our", "ours", "ourselves", "out",
            "over", "own", "per", "perhaps", "rather", "same", "see", "seem", "several", "she",
            "should", "since", "so", "some", "somehow", "someone", "something", "sometime", "still",
            "such", "than", "that", "the", "their", "them", "themselves", "then", "there", "these",
            "they", "this", "those", "though", "through", "thus", "to", "together", "too", "toward",
            "under", "until", "up", "upon", "us", "very", "via", "was", "we", "well", "were", "what",
            "whatever", "when", "where", "whether", "which", "while", "who", "whole", "whom", "whose",
            "why", "will", "with", "within", "without", "would", "yet", "you", "your", "yours",
            "yourself", "yourselves"
    );
}
