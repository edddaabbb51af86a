package in.sitewatch.application.port.output;

/**
 * Outbound SMS delivery.
 */
@FunctionalInterface
public interface SmsGateway {

    /**
     * @throws Exception any failure; the SMS channel reports it as a delivery failure
     */
    void sendText(String number, String text) throws Exception;
}
