package at.sv.huepanel.api;

import java.net.URL;

public interface HttpResourceProvider {
    /**
     * @param applicationKey the key sent as {@code hue-application-key} header
     * @return the requested resource as string. Not null.
     * @throws BridgeAuthenticationFailure if the server rejected the response as unauthorized (401, 403)
     * @throws BridgeConnectionFailure     if an IOException occurred
     * @throws ResourceNotFoundException   if the response code is 404
     * @throws ApiFailure                  if the response code is 5xx or 429
     */
    String getResource(URL url, String applicationKey);
}
