package net.checkin.bootstrap.catalog;

import net.checkin.bootstrap.props.CheckinProperties;
import net.checkin.core.model.Account;
import net.checkin.core.model.TriggerTime;
import net.checkin.core.spi.AccountRepository;
import net.checkin.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upserts the accounts declared under {@code checkin.catalog.accounts} by name.
 * Does not reconcile the schedule; the startup runner does that once afterwards.
 */
public class AccountCatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(AccountCatalogRegistrar.class);

    private final AccountRepository accounts;
    private final TxRunner tx;

    public AccountCatalogRegistrar(AccountRepository accounts, TxRunner tx) {
        this.accounts = accounts;
        this.tx = tx;
    }

    /** @return number of accounts inserted or updated */
    public int register(CheckinProperties.Catalog catalog) throws Exception {
        int n = 0;
        for (var def : catalog.getAccounts()) {
            upsert(def);
            n++;
        }
        return n;
    }

    private void upsert(CheckinProperties.AccountDef def) throws Exception {
        if (def.getName() == null || def.getName().isBlank()) {
            throw new IllegalArgumentException("catalog account name is required");
        }
        String name = def.getName().trim();
        String time = def.getCheckinTime() == null || def.getCheckinTime().isBlank()
                ? Account.DEFAULT_CHECKIN_TIME
                : TriggerTime.parse(def.getCheckinTime()).toString();

        boolean created = tx.required(() -> {
            var existing = accounts.findByName(name);
            if (existing.isEmpty()) {
                if (def.getCredentials() == null || def.getCredentials().isBlank()) {
                    throw new IllegalArgumentException("catalog account '" + name + "' needs credentials");
                }
                accounts.insert(new Account(null, name, def.getCredentials(), def.isEnabled(), time, null, null));
                return true;
            }
            Account cur = existing.get();
            String creds = def.getCredentials() == null || def.getCredentials().isBlank()
                    ? cur.credentials() : def.getCredentials();
            accounts.update(new Account(cur.id(), name, creds, def.isEnabled(), time, cur.createdAt(), null));
            return false;
        });
        log.info("Catalog account {}: {}", created ? "registered" : "updated", def);
    }
}
