package fun.fengwk.bmh.core.facade.api.extractor;

import fun.fengwk.bmh.core.facade.api.ProbeResponse;

/**
 * Reads a dollar balance out of a probe response. Extractors are tried in order, first hit wins.
 *
 * @author fengwk
 */
public interface BalanceExtractor {

    /**
     * Prefix of the source tag, e.g. {@code header}.
     */
    String name();

    /**
     * Human readable description of a hit.
     */
    String describe();

    /**
     * @return balance in dollars, or {@code null} when the response carries none
     */
    Double extract(ProbeResponse response);

}
