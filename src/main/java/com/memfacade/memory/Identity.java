package com.memfacade.memory;

public record Identity(String userId, String agentId, String runId) {

    private static final Identity NONE = new Identity(null, null, null);

    public static Identity none() { return NONE; }

    public static Identity ofUser(String userId) {
        return new Identity(userId, null, null);
    }

    public boolean isEmpty() {
        return userId == null && agentId == null && runId == null;
    }
}
