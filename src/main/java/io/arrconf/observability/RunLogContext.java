package io.arrconf.observability;

import io.arrconf.model.InstanceRef;
import io.arrconf.model.RunStage;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

public final class RunLogContext implements AutoCloseable {
    public static final String PLUGIN = "plugin";
    public static final String INSTANCE = "instance";
    public static final String STAGE = "stage";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private RunLogContext(Map<String, String> values) {
        for (Map.Entry<String, String> entry : values.entrySet()) {
            previous.put(entry.getKey(), MDC.get(entry.getKey()));
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
    }

    public static RunLogContext stage(RunStage stage) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(STAGE, stage.label());
        return new RunLogContext(values);
    }

    public static RunLogContext plugin(String pluginName) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(PLUGIN, pluginName);
        values.put(INSTANCE, null);
        return new RunLogContext(values);
    }

    public static RunLogContext instance(InstanceRef instance) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(PLUGIN, instance.pluginName());
        values.put(INSTANCE, instance.instanceName());
        return new RunLogContext(values);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
    }
}
