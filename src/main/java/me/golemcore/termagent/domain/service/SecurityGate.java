/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.termagent.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.model.RiskTier;
import me.golemcore.termagent.domain.model.SecurityVerdict;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Classifies shell commands by risk. Classification depends only on the command
 * text and the patterns fixed at construction, so the same command always gets
 * the same verdict. The gate never runs anything.
 *
 * <p>
 * When command execution is disabled by configuration every command is
 * {@link RiskTier#BLOCKED}.
 */
@Component
@Slf4j
public class SecurityGate {

    // Matches within one shell segment (stops at ; & | and newlines).
    private static final String SEGMENT = "[^;&|\\n]*";

    private static final List<RiskRule> DANGEROUS_RULES = List.of(
            rule("\\brm\\b(?=" + SEGMENT + "\\s(?:-[a-zA-Z]*[rR][a-zA-Z]*|--recursive)(?:\\s|$))(?=" + SEGMENT
                    + "\\s(?:-[a-zA-Z]*f[a-zA-Z]*|--force)(?:\\s|$))", "recursive forced deletion"),
            rule("\\brm\\b" + SEGMENT + "\\s(?:/|/\\*|~/?|\\$HOME/?)(?:\\s|$)", "deletion of the root or home directory"),
            rule("\\bdd\\b" + SEGMENT + "\\bif=", "raw disk copy with dd"),
            rule("\\bmkfs(?:\\.\\w+)?\\b", "filesystem creation"),
            rule("\\b(?:fdisk|sfdisk|gdisk|parted)\\b", "partition table change"),
            rule("\\bwipefs\\b", "filesystem signature wipe"),
            rule("\\bshred\\b", "irreversible file shredding"),
            rule(">\\s*/dev/(?:sd|hd|vd|xvd|nvme|mmcblk)", "raw write to a block device"),
            rule(":\\s*\\(\\s*\\)\\s*\\{[^}]*:\\s*\\|\\s*:", "fork bomb"),
            rule("\\bchmod\\b" + SEGMENT + "\\s-[a-zA-Z]*R[a-zA-Z]*\\s+\\S+\\s+/(?:\\s|$)",
                    "recursive permission change on the root directory"),
            rule("\\bchmod\\s+0?777\\s+/(?:\\s|$)", "world-writable root directory"),
            rule("\\b(?:sudo|doas|su\\s+-c)\\b" + SEGMENT + "\\b(?:rm|dd|mkfs|shred|wipefs|truncate)\\b",
                    "privilege escalation combined with a destructive command"),
            rule("\\bfind\\b" + SEGMENT + "\\s-delete\\b", "bulk deletion with find"),
            rule("\\bfind\\b" + SEGMENT + "-exec\\s+rm\\b", "bulk deletion with find"),
            rule("\\b(?:curl|wget)\\b[^|\\n]*\\|\\s*(?:sudo\\s+)?(?:ba|z|k|da)?sh\\b",
                    "downloaded script piped into a shell"),
            rule("\\bcrontab\\s+-r\\b", "removal of all cron jobs"),
            rule("\\biptables\\s+(?:-F|--flush)\\b", "firewall rules flush"),
            rule("\\b(?:shutdown|reboot|halt|poweroff)\\b", "host shutdown or reboot"),
            rule("\\binit\\s+[06]\\b", "host shutdown or reboot"),
            rule("\\bsystemctl\\s+(?:reboot|poweroff|halt|kexec)\\b", "host shutdown or reboot"));

    private static final List<RiskRule> CAUTION_RULES = List.of(
            rule("\\b(?:sudo|doas)\\b", "runs with elevated privileges"),
            rule("(?:^|[;&|]\\s*)su(?:\\s|$)", "switches user"),
            rule("\\b(?:chmod|chown|chgrp)\\b", "changes file permissions or ownership"),
            rule("(?:^|[;&|(]\\s*)rm\\s", "deletes files"),
            rule("(?:^|[;&|(]\\s*)mv\\s", "moves or overwrites files"),
            rule("\\bsystemctl\\s+(?:stop|disable|mask|restart)\\b", "changes service state"),
            rule("\\bservice\\s+\\S+\\s+(?:stop|restart)\\b", "changes service state"),
            rule("\\b(?:kill|pkill|killall)\\b", "terminates processes"),
            rule("\\b(?:apt|apt-get|yum|dnf|zypper|snap)\\s+(?:-\\S+\\s+)*(?:remove|purge|autoremove|erase)\\b",
                    "removes packages"),
            rule("\\bpacman\\s+-R", "removes packages"),
            rule("\\b(?:mount|umount)\\b", "changes mounted filesystems"),
            rule("\\b(?:useradd|userdel|usermod|groupadd|groupdel|passwd)\\b", "changes user accounts"),
            rule("\\b(?:iptables|ip6tables|ufw|firewall-cmd|nft)\\b", "changes firewall configuration"),
            rule(">\\s*/etc/", "overwrites system configuration"),
            rule("(?:^|[;&|]\\s*)(?:vi|vim|nvim|nano|emacs|less|more|top|htop|watch|man|tmux|screen)(?:\\s|$)",
                    "interactive program that blocks until the timeout"));

    private final boolean executionEnabled;
    private final List<RiskRule> dangerousRules;
    private final List<RiskRule> cautionRules;

    public SecurityGate(AgentProperties properties) {
        this.executionEnabled = properties.getExecution().isCommandExecutionEnabled();
        AgentProperties.SecurityProperties security = properties.getSecurity();
        this.dangerousRules = merge(DANGEROUS_RULES, security.getDangerousPatterns(), "configured dangerous pattern");
        this.cautionRules = merge(CAUTION_RULES, security.getCautionPatterns(), "configured caution pattern");
        if (!executionEnabled) {
            log.warn("[Security] Command execution is disabled; every command will be blocked");
        }
    }

    public SecurityVerdict classify(String command) {
        if (!executionEnabled) {
            return new SecurityVerdict(RiskTier.BLOCKED, "command execution is disabled by configuration");
        }
        if (command == null || command.isBlank()) {
            return new SecurityVerdict(RiskTier.CAUTION, "empty command");
        }
        String normalized = command.strip().replaceAll("[ \\t]+", " ");
        for (RiskRule rule : dangerousRules) {
            if (rule.pattern().matcher(normalized).find()) {
                return new SecurityVerdict(RiskTier.DANGEROUS, rule.rationale());
            }
        }
        for (RiskRule rule : cautionRules) {
            if (rule.pattern().matcher(normalized).find()) {
                return new SecurityVerdict(RiskTier.CAUTION, rule.rationale());
            }
        }
        return SecurityVerdict.safe();
    }

    public boolean isExecutionEnabled() {
        return executionEnabled;
    }

    private static List<RiskRule> merge(List<RiskRule> defaults, List<String> extra, String rationale) {
        if (extra == null || extra.isEmpty()) {
            return defaults;
        }
        List<RiskRule> rules = new ArrayList<>(defaults);
        for (String pattern : extra) {
            try {
                rules.add(new RiskRule(Pattern.compile(pattern), rationale + " " + pattern));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid security pattern: " + pattern, e);
            }
        }
        return Collections.unmodifiableList(rules);
    }

    private static RiskRule rule(String regex, String rationale) {
        return new RiskRule(Pattern.compile(regex), rationale);
    }

    private record RiskRule(Pattern pattern, String rationale) {
    }
}
