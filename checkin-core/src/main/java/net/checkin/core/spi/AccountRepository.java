package net.checkin.core.spi;

import net.checkin.core.model.Account;

import java.util.List;
import java.util.Optional;

public interface AccountRepository {
    List<Account> listEnabled() throws Exception;
    Optional<Account> get(long id) throws Exception;

    Optional<Account> findByName(String name) throws Exception;
    List<Account> listAll() throws Exception;
    long countAll() throws Exception;
    long countEnabled() throws Exception;

    /** Inserts and returns the stored row (with id). Name must be unique. */
    Account insert(Account account) throws Exception;

    /** Updates enabled/checkinTime/credentials by id; false if the row is gone. */
    boolean update(Account account) throws Exception;

    /** Deletes the account together with its check-in history. */
    boolean delete(long id) throws Exception;
}
