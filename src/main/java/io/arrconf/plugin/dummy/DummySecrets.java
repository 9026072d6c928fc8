package io.arrconf.plugin.dummy;

import com.fasterxml.jackson.databind.JsonNode;
import io.arrconf.plugin.InstanceSecrets;
import io.arrconf.plugin.RemoteApiException;

import java.time.Duration;

record DummySecrets(String hostUrl, String apiKey, Duration timeout) implements InstanceSecrets {
    DummyApiClient client() {
        return new DummyApiClient(hostUrl, apiKey, timeout);
    }

    @Override
    public boolean test() {
        try {
            JsonNode status = client().get("/api/v1/status");
            return status.hasNonNull("instanceId");
        } catch (RemoteApiException e) {
            if (e.status() == 401 || e.status() == 403) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public String toString() {
        return "DummySecrets[hostUrl=" + hostUrl + ", apiKey=***]";
    }
}
