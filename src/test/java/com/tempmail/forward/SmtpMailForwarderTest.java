package com.tempmail.forward;

import com.tempmail.config.ForwardRules;
import com.tempmail.config.ServerProperties;
import com.tempmail.domain.EnvelopeRecipient;
import com.tempmail.domain.InboundMail;
import com.tempmail.util.DnsUtil;
import jakarta.mail.MessagingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Delivery route selection for forwarded mail; no connection is ever opened
 */
class SmtpMailForwarderTest {

    private ServerProperties properties;
    private List<String> lookedUp;
    private InboundMail mail;

    @BeforeEach
    void setUp() {
        properties = new ServerProperties();
        lookedUp = new ArrayList<>();
        mail = InboundMail.of("Subject: hi\r\n\r\nbody".getBytes(StandardCharsets.UTF_8), "s@ext.org",
                EnvelopeRecipient.single("shop1@temp.example.com"));
    }

    private SmtpMailForwarder forwarderWithMx(List<String> mxHosts) {
        return new SmtpMailForwarder(properties, domain -> {
            lookedUp.add(domain);
            return mxHosts;
        });
    }

    @Test
    @DisplayName("Without a relay host, the target domain's MX hosts are used on port 25")
    void testMxFallback() {
        SmtpMailForwarder forwarder = forwarderWithMx(List.of("mx1.real.org", "mx2.real.org"));

        SmtpMailForwarder.Route route = forwarder.route("Me@Real.ORG");

        assertThat(route.hosts()).containsExactly("mx1.real.org", "mx2.real.org");
        assertThat(route.port()).isEqualTo(25);
        assertThat(lookedUp).containsExactly("real.org");
    }

    @Test
    @DisplayName("A configured relay host bypasses MX lookup")
    void testRelayHost() {
        properties.getForward().setRelayHost(" relay.internal ");
        properties.getForward().setRelayPort(2525);
        SmtpMailForwarder forwarder = forwarderWithMx(List.of("mx1.real.org"));

        SmtpMailForwarder.Route route = forwarder.route("me@real.org");

        assertThat(route.hosts()).containsExactly("relay.internal");
        assertThat(route.port()).isEqualTo(2525);
        assertThat(lookedUp).isEmpty();
    }

    @Test
    @DisplayName("No delivery host: forwarding fails without connecting")
    void testNoDeliveryHost() {
        SmtpMailForwarder forwarder = forwarderWithMx(List.of());

        assertThatThrownBy(() -> forwarder.forwardToTarget(mail, "me@real.org"))
                .isInstanceOf(MessagingException.class)
                .hasMessageContaining("No delivery host");
        assertThat(lookedUp).containsExactly("real.org");
    }

    @Test
    @DisplayName("Target without a domain has no MX route")
    void testTargetWithoutDomain() {
        SmtpMailForwarder forwarder = new SmtpMailForwarder(properties, DnsUtil::lookupMx);

        assertThat(forwarder.route("nobody").hosts()).isEmpty();
        assertThatThrownBy(() -> forwarder.forwardToTarget(mail, "nobody"))
                .isInstanceOf(MessagingException.class);
    }

    @Test
    @DisplayName("Local part without a rule is not forwarded")
    void testNoMatchingRule() throws MessagingException {
        SmtpMailForwarder forwarder = forwarderWithMx(List.of("mx1.real.org"));
        ForwardRules rules = new ForwardRules(
                List.of(new ForwardRules.Rule("news", "me@real.org")), List.of("temp.example.com"));

        forwarder.forwardByLocalPart(mail, "shop1", rules);

        assertThat(lookedUp).isEmpty();
    }
}
