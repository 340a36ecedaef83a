package fun.fengwk.bmh.core.facade.api;

/**
 * Cheap balance lookup through the service's structured api.
 *
 * @author fengwk
 */
public interface FastBalanceProbe {

    /**
     * Query the balance behind an api key. Never throws, failures are reported in the result.
     */
    ApiBalanceResult queryBalance(String apiKey);

}
