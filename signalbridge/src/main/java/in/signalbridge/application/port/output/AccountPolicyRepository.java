package in.signalbridge.application.port.output;

import in.signalbridge.domain.account.AccountTradingPolicy;

/**
 * Repository for the account_settings table.
 *
 * The execution path only reads. Writes come from the account-settings endpoint.
 */
public interface AccountPolicyRepository {

    /**
     * @return stored policy, or {@link AccountTradingPolicy#defaults(String)} when none exists
     */
    AccountTradingPolicy getPolicy(String accountId);

    /**
     * Insert or replace the policy for its account.
     */
    void upsert(AccountTradingPolicy policy);
}
