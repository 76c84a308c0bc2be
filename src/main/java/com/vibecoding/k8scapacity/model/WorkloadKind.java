package com.vibecoding.k8scapacity.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 리소스 집계 대상 워크로드 종류
 */
public enum WorkloadKind {
    DEPLOYMENT("Deployment", false),
    STATEFUL_SET("StatefulSet", false),
    DEPLOYMENT_CONFIG("DeploymentConfig", false),
    DAEMON_SET("DaemonSet", true),
    POD("Pod", false);

    private final String kindName;
    private final boolean perNode;

    WorkloadKind(String kindName, boolean perNode) {
        this.kindName = kindName;
        this.perNode = perNode;
    }

    public String getKindName() {
        return kindName;
    }

    /**
     * One pod template replicated on every node; its real multiplier is the node count.
     */
    public boolean isPerNode() {
        return perNode;
    }

    public static Optional<WorkloadKind> fromKindName(String kindName) {
        return Arrays.stream(values())
                .filter(kind -> kind.kindName.equalsIgnoreCase(kindName))
                .findFirst();
    }
}
