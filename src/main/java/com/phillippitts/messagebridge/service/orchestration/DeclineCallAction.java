package com.phillippitts.messagebridge.service.orchestration;

import com.phillippitts.messagebridge.config.properties.AutomationProperties;
import com.phillippitts.messagebridge.domain.CallEvent;
import com.phillippitts.messagebridge.service.automation.AppleScripts;
import com.phillippitts.messagebridge.service.automation.OsaScriptRunner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.List;

/** Step 1: click "Decline" on the incoming call banner. Fails when no call UI is showing. */
@Component
class DeclineCallAction implements TriggerAction {

    static final String NAME = "decline";

    private final OsaScriptRunner runner;
    private final String script;
    private final boolean enabled;

    @Autowired
    DeclineCallAction(OsaScriptRunner runner, AutomationProperties props, ResourceLoader loader) {
        this(runner, AppleScripts.load(loader, props.getDeclineScript()), props.isDeclineEnabled());
    }

    DeclineCallAction(OsaScriptRunner runner, String script, boolean enabled) {
        this.runner = runner;
        this.script = script;
        this.enabled = enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void execute(CallEvent event) {
        runner.run(NAME, script, List.of());
    }

    @Override
    public String name() {
        return NAME;
    }
}
