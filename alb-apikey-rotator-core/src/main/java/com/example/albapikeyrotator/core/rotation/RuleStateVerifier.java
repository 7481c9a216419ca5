package com.example.albapikeyrotator.core.rotation;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.albapikeyrotator.core.PendingKeyVerificationException;
import com.example.albapikeyrotator.core.alb.RuleLocator;
import com.example.albapikeyrotator.core.secrets.CredentialPayload;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-reads the load balancer rules and checks that every API-key condition carries exactly the
 * pending key.
 *
 * <p>Finding no API-key condition at all is logged but accepted, matching the set step which
 * treats such load balancers as a no-op.
 */
public final class RuleStateVerifier implements PendingKeyVerifier {

  private static final System.Logger LOGGER = System.getLogger(RuleStateVerifier.class.getName());

  private final RuleLocator locator;

  public RuleStateVerifier(final RuleLocator locator) {
    this.locator = locator;
  }

  @Override
  public void verify(
      final String secretId, final CredentialPayload current, final CredentialPayload pending) {
    final var expected = List.of(pending.activeKey());
    final var problems = new ArrayList<String>();
    int checked = 0;
    for (final var match : locator.locateAll()) {
      for (final var condition : match.apiKeyConditions()) {
        checked++;
        if (!expected.equals(condition.httpHeaderConfig().values())) {
          problems.add(
              "rule %s on %s carries %d value(s) other than the pending key"
                  .formatted(
                      match.rule().arn(),
                      match.location().loadBalancerName(),
                      condition.httpHeaderConfig().values().size()));
        }
      }
    }
    if (checked == 0) {
      LOGGER.log(WARNING, "No API-key rule conditions found while testing {0}", secretId);
      return;
    }
    if (!problems.isEmpty()) throw new PendingKeyVerificationException(problems);
    LOGGER.log(
        INFO, "All {0} API-key condition(s) carry the pending key of {1}", checked, secretId);
  }
}
