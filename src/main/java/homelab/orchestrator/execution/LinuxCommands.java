package homelab.orchestrator.execution;

import homelab.orchestrator.model.NodeAction;

import java.util.Map;

/**
 * Shell command for each node action on a Linux host.
 */
public final class LinuxCommands {

    public static final String DEFAULT_DEPLOY_PATH = "/opt/homelab";

    private LinuxCommands() {
    }

    /**
     * @param deployPath compose project directory, {@link #DEFAULT_DEPLOY_PATH} when null
     * @throws IllegalArgumentException if a required parameter is missing or the action is not a command
     */
    public static String forAction(NodeAction action, Map<String, Object> params, String deployPath) {
        Map<String, Object> p = params != null ? params : Map.of();
        String path = deployPath != null && !deployPath.isBlank() ? deployPath : DEFAULT_DEPLOY_PATH;

        return switch (action) {
            case EXECUTE_COMMAND -> required(p, "command");
            case DOCKER_ACTION -> docker(p);
            case DEPLOY_SERVICE -> ("cd " + path + " && docker-compose up -d " + text(p, "service", "")).trim();
            case RESTART_SERVICE -> Boolean.TRUE.equals(p.get("useSystemd"))
                    ? "sudo systemctl restart " + required(p, "service")
                    : "docker restart " + required(p, "service");
            case GIT_PULL -> "cd " + path + " && git pull";
            case CHECK_STATUS -> "docker ps --format '{{.Names}}: {{.Status}}'";
            case VM_CONTROL -> virsh(p);
            case AI_GENERATE, CUSTOM -> text(p, "command", "echo ok");
            case WAKE -> throw new IllegalArgumentException("wake is not a shell command");
        };
    }

    private static String docker(Map<String, Object> p) {
        String container = required(p, "container");
        String verb = required(p, "action");
        if ("logs".equals(verb)) {
            return "docker logs --tail " + text(p, "lines", "50") + " " + container;
        }
        return "docker " + verb + " " + container;
    }

    private static String virsh(Map<String, Object> p) {
        String verb = required(p, "action");
        if ("list".equals(verb)) {
            return "virsh list --all";
        }
        String vm = required(p, "vm");
        return switch (verb) {
            case "start" -> "virsh start " + vm;
            case "stop" -> "virsh shutdown " + vm;
            case "force-stop" -> "virsh destroy " + vm;
            case "status" -> "virsh domstate " + vm;
            default -> "virsh " + verb + " " + vm;
        };
    }

    static String required(Map<String, Object> p, String key) {
        String value = text(p, key, null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }

    static String text(Map<String, Object> p, String key, String fallback) {
        Object value = p.get(key);
        return value != null ? String.valueOf(value) : fallback;
    }
}
