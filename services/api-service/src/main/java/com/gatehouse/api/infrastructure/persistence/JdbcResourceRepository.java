package com.gatehouse.api.infrastructure.persistence;

import com.gatehouse.api.domain.Resource;
import com.gatehouse.security.StorageException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Resource rows in the {@code resources} table. Failures surface as {@link StorageException}.
 */
@Repository
public class JdbcResourceRepository {

    private static final String SELECT_PAGE = """
            SELECT id, name, data FROM resources
            ORDER BY name, id
            LIMIT :size OFFSET :skip
            """;

    private static final String SELECT_BY_ID = "SELECT id, name, data FROM resources WHERE id = :id";

    private static final String INSERT = "INSERT INTO resources (id, name, data) VALUES (:id, :name, :data)";

    private static final String UPDATE = "UPDATE resources SET name = :name, data = :data WHERE id = :id";

    private static final String DELETE = "DELETE FROM resources WHERE id = :id";

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    JdbcResourceRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
    }

    public List<Resource> findPage(int skip, int size) {
        try {
            return jdbc.query(SELECT_PAGE,
                    new MapSqlParameterSource().addValue("skip", skip).addValue("size", size), this::mapRow);
        } catch (DataAccessException e) {
            throw new StorageException("Unable to list resources", e);
        }
    }

    public Optional<Resource> findById(UUID id) {
        try {
            return jdbc.query(SELECT_BY_ID, new MapSqlParameterSource("id", id), this::mapRow).stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Unable to load resource " + id, e);
        }
    }

    public void insert(Resource resource) {
        try {
            jdbc.update(INSERT, parameters(resource));
        } catch (DataAccessException e) {
            throw new StorageException("Unable to insert resource " + resource.id(), e);
        }
    }

    /**
     * @return true if a row was updated
     */
    public boolean update(Resource resource) {
        try {
            return jdbc.update(UPDATE, parameters(resource)) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Unable to update resource " + resource.id(), e);
        }
    }

    /**
     * @return true if a row was deleted
     */
    public boolean delete(UUID id) {
        try {
            return jdbc.update(DELETE, new MapSqlParameterSource("id", id)) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Unable to delete resource " + id, e);
        }
    }

    private MapSqlParameterSource parameters(Resource resource) {
        return new MapSqlParameterSource()
                .addValue("id", resource.id())
                .addValue("name", resource.name())
                .addValue("data", json.writeObject(resource.data()));
    }

    private Resource mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Resource(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                json.readObject(rs.getString("data")));
    }
}
