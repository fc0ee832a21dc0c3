package io.slotsync.core.era;

import lombok.Getter;
import lombok.ToString;

/**
 * An {@link EraInterpreter} over a fixed {@link Summary}.
 */
@Getter
@ToString
public class SummaryInterpreter implements EraInterpreter {

    private final Summary summary;

    public SummaryInterpreter(Summary summary) {
        this.summary = summary;
    }

    @Override
    public <T> T interpretQuery(EraQuery<T> query) throws PastHorizonException {
        for (EraSummary era : summary.getEras()) {
            if (query.isContainedIn(era)) {
                try {
                    return query.answerIn(era);
                } catch (ArithmeticException e) {
                    // the era contains the query but the answer is not representable
                    throw new PastHorizonException(query.toString(), summary.getEras(), e);
                }
            }
        }
        throw new PastHorizonException(query.toString(), summary.getEras());
    }
}
