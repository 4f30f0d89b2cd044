package com.gatehouse.api.infrastructure.persistence;

import com.gatehouse.security.Principal;
import com.gatehouse.security.PrincipalStatus;
import com.gatehouse.security.StorageException;
import com.gatehouse.security.UserStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link UserStore} backed by the {@code users} table.
 *
 * <p>Every {@link DataAccessException} is rethrown as {@link StorageException}. An unknown stored
 * status reads as {@link PrincipalStatus#INACTIVE}.
 */
@Repository
public class JdbcUserRepository implements UserStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcUserRepository.class);

    private static final String SELECT_BY_ID = """
            SELECT id, name, email, status, scopes, hashed_password, data
            FROM users
            WHERE id = :id
            """;

    private static final String INSERT = """
            INSERT INTO users (id, name, email, status, scopes, hashed_password, data)
            VALUES (:id, :name, :email, :status, :scopes, :hashedPassword, :data)
            """;

    private static final String UPDATE = """
            UPDATE users
            SET name = :name, email = :email, status = :status, scopes = :scopes,
                hashed_password = :hashedPassword, data = :data
            WHERE id = :id
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    JdbcUserRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
    }

    @Override
    public Optional<Principal> get(String id) {
        try {
            List<Principal> rows = jdbc.query(SELECT_BY_ID, new MapSqlParameterSource("id", id), this::mapRow);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Unable to load user " + id, e);
        }
    }

    public void insert(Principal principal) {
        try {
            jdbc.update(INSERT, parameters(principal));
            log.debug("Inserted user {}", principal.id());
        } catch (DataAccessException e) {
            throw new StorageException("Unable to insert user " + principal.id(), e);
        }
    }

    /**
     * @return true if a row was updated, false if the user no longer exists
     */
    public boolean update(Principal principal) {
        try {
            return jdbc.update(UPDATE, parameters(principal)) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Unable to update user " + principal.id(), e);
        }
    }

    private MapSqlParameterSource parameters(Principal principal) {
        return new MapSqlParameterSource()
                .addValue("id", principal.id())
                .addValue("name", principal.name())
                .addValue("email", principal.email())
                .addValue("status", principal.status().value())
                .addValue("scopes", json.writeStrings(principal.scopes()))
                .addValue("hashedPassword", principal.hashedPassword())
                .addValue("data", json.writeObject(principal.data()));
    }

    private Principal mapRow(ResultSet rs, int rowNum) throws SQLException {
        String status = rs.getString("status");
        return new Principal(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("email"),
                PrincipalStatus.fromValue(status).orElse(PrincipalStatus.INACTIVE),
                json.readStrings(rs.getString("scopes")),
                rs.getString("hashed_password"),
                json.readObject(rs.getString("data")));
    }
}
