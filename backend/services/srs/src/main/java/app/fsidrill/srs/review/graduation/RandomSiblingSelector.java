package app.fsidrill.srs.review.graduation;

import app.fsidrill.srs.review.domain.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class RandomSiblingSelector implements SiblingSelector {

    private final Random random;

    public RandomSiblingSelector(Random random) {
        this.random = random;
    }

    // Fisher-Yates
    @Override
    public List<Card> shuffle(List<Card> candidates) {
        List<Card> out = new ArrayList<>(candidates);
        for (int i = out.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            Card tmp = out.get(i);
            out.set(i, out.get(j));
            out.set(j, tmp);
        }
        return out;
    }
}
