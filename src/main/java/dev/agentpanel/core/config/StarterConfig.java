package dev.agentpanel.core.config;

/**
 * Template written when no config.toml exists. Every line is a comment, so parsing it yields the
 * all-defaults configuration.
 */
public final class StarterConfig {
    public static final String TEMPLATE = """
        # AgentPanel configuration
        #
        # [app] (optional) - Application settings
        # - autoStartAtLogin: launch AgentPanel when you log in (default: false)
        #
        # [agentLayer] (optional) - Global Agent Layer settings
        # - enabled: default useAgentLayer value for all projects (default: false)
        #
        # [chrome] (optional) - Global Chrome tab settings
        # - pinnedTabs: URLs always opened as leftmost tabs in every fresh Chrome window
        # - defaultTabs: URLs opened when no tab history exists for a project
        # - openGitRemote: auto-detect git remote URL and add it as an always-open tab (default: false)
        #
        # [layout] (optional) - Window positioning settings (requires Accessibility permission)
        # - smallScreenThreshold: physical monitor width in inches below which "small mode" is used (default: 24)
        # - windowHeight: window height as %% of screen height, 1-100 (default: 90)
        # - maxWindowWidth: max window width in inches (default: 18)
        # - idePosition: IDE window side, "left" or "right" (default: "left")
        # - justification: which screen edge windows align to, "left" or "right" (default: "right")
        # - maxGap: max gap between windows as %% of screen width, 0-100 (default: 10)
        #
        # Each [[project]] entry describes one git repo (local or SSH remote).
        # - name: Display name (id is derived by lowercasing and replacing non [a-z0-9] with '-')
        # - remote: (optional) VS Code SSH remote authority (e.g., ssh-remote+user@host)
        # - path: Absolute path to the repo (local when remote is absent, remote path when remote is set)
        # - color: "#RRGGBB" or a named color (%s)
        # - useAgentLayer: (optional) override the global agentLayer.enabled default per project
        # - chromePinnedTabs: (optional) per-project URLs always opened as leftmost tabs
        # - chromeDefaultTabs: (optional) per-project URLs opened when no tab history exists
        #
        # Example:
        #
        # [app]
        # autoStartAtLogin = true
        #
        # [agentLayer]
        # enabled = true
        #
        # [chrome]
        # pinnedTabs = ["https://dashboard.example.com"]
        # defaultTabs = ["https://docs.example.com"]
        # openGitRemote = true
        #
        # [layout]
        # smallScreenThreshold = 24
        # windowHeight = 90
        # maxWindowWidth = 18
        # idePosition = "left"
        # justification = "right"
        # maxGap = 10
        #
        # [[project]]
        # name = "AgentPanel"
        # path = "/Users/you/src/agent-panel"
        # color = "indigo"
        # useAgentLayer = false
        # chromePinnedTabs = ["https://api.example.com"]
        # chromeDefaultTabs = ["https://jira.example.com"]
        #
        # [[project]]
        # name = "Remote ML"
        # remote = "ssh-remote+you@my-remote-host.local"
        # path = "/home/you/src/local-ml"
        # color = "teal"
        # useAgentLayer = false
        """.formatted(String.join(", ", ProjectColorPalette.sortedNames()));

    private StarterConfig() {}
}
