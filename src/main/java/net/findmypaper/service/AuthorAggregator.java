package net.findmypaper.service;

import net.findmypaper.domain.AuthorProfile;
import net.findmypaper.domain.RecommendationSet;
import net.findmypaper.domain.ScoredPaper;
import org.springframework.stereotype.Component;

/**
 * Counts how many recommended papers list each author.
 */
@Component
public class AuthorAggregator {

    public AuthorProfile aggregate(RecommendationSet recommendations) {
        AuthorProfile profile = new AuthorProfile();
        for (ScoredPaper row : recommendations) {
            for (String author : row.paper().getAuthors()) {
                profile.add(author);
            }
        }
        return profile;
    }
}
