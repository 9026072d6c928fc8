package io.arrconf.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

public final class SignalSupport {
    public static final String RELOAD_SIGNAL = "HUP";

    private static final Logger log = LoggerFactory.getLogger(SignalSupport.class);

    private SignalSupport() {
    }

    public static boolean onReload(Runnable action) {
        try {
            Signal.handle(new Signal(RELOAD_SIGNAL), signal -> {
                log.info("Received SIG{}, reloading configuration", signal.getName());
                action.run();
            });
            return true;
        } catch (IllegalArgumentException e) {
            log.debug("Reload signal SIG{} not supported on this platform: {}", RELOAD_SIGNAL, e.getMessage());
            return false;
        }
    }
}
