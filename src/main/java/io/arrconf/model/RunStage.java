package io.arrconf.model;

public enum RunStage {
    RENDER_PRE_INIT,
    INITIALIZE_INSTANCES,
    RENDER_POST_INIT,
    FETCH_SECRETS,
    FETCH_REMOTE,
    COMPUTE_DIFF,
    APPLY_UPDATES,
    DELETE_UNMANAGED;

    public String label() {
        return name().toLowerCase().replace('_', '-');
    }
}
