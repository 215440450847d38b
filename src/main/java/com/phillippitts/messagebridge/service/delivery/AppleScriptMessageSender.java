package com.phillippitts.messagebridge.service.delivery;

import com.phillippitts.messagebridge.config.properties.AutomationProperties;
import com.phillippitts.messagebridge.exception.AutomationException;
import com.phillippitts.messagebridge.exception.SendFailureException;
import com.phillippitts.messagebridge.service.automation.AppleScripts;
import com.phillippitts.messagebridge.service.automation.OsaScriptRunner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sends iMessages by driving Messages.app through {@code osascript}.
 */
@Component
class AppleScriptMessageSender implements MessageSender {

    private final OsaScriptRunner runner;
    private final String script;

    @Autowired
    AppleScriptMessageSender(OsaScriptRunner runner, AutomationProperties props, ResourceLoader loader) {
        this(runner, AppleScripts.load(loader, props.getSendScript()));
    }

    AppleScriptMessageSender(OsaScriptRunner runner, String script) {
        this.runner = runner;
        this.script = script;
    }

    @Override
    public void send(String recipient, String body) {
        try {
            runner.run("send", script, List.of(recipient, body));
        } catch (AutomationException e) {
            throw new SendFailureException("Messages.app send failed", recipient, e);
        }
    }
}
