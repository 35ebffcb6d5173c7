package app.fsidrill.srs.review.graduation;

import app.fsidrill.srs.review.domain.Card;

import java.util.List;

/**
 * Orders candidate siblings for canonical swaps and reactivation. The default is a uniform shuffle.
 */
@FunctionalInterface
public interface SiblingSelector {

    List<Card> shuffle(List<Card> candidates);
}
