package com.rpaflow.core.model;

import java.util.Objects;

public final class Node {
    private final String id;
    private final Activity activity;

    public Node(String id, Activity activity) {
        this.id = Objects.requireNonNull(id, "id");
        this.activity = Objects.requireNonNull(activity, "activity");
    }

    public String getId() { return id; }
    public Activity getActivity() { return activity; }
    public ActivityType getType() { return activity.getType(); }

    @Override
    public String toString() {
        return id + ":" + activity;
    }
}
