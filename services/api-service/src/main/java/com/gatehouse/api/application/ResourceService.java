package com.gatehouse.api.application;

import com.gatehouse.api.domain.PageQuery;
import com.gatehouse.api.domain.Resource;
import com.gatehouse.api.domain.ResourcePatch;
import com.gatehouse.api.error.ApiException;
import com.gatehouse.api.infrastructure.persistence.JdbcResourceRepository;
import com.gatehouse.security.StorageException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * CRUD over resources, translating storage failures and missing rows into API errors.
 */
@Service
public class ResourceService {

    private static final Logger log = LoggerFactory.getLogger(ResourceService.class);

    static final String NOT_FOUND = "resource not found";

    private final JdbcResourceRepository resources;

    public ResourceService(JdbcResourceRepository resources) {
        this.resources = resources;
    }

    public List<Resource> list(PageQuery query) {
        try {
            return resources.findPage(query.skip(), query.size());
        } catch (StorageException e) {
            throw ApiException.database("unable to get resources", query, e);
        }
    }

    public Resource get(UUID id) {
        try {
            return resources.findById(id).orElseThrow(() -> ApiException.notFound(NOT_FOUND, id));
        } catch (StorageException e) {
            throw ApiException.database("unable to get resource", id, e);
        }
    }

    public Resource create(Resource resource) {
        Resource toCreate = resource.id() == null ? resource.withId(UUID.randomUUID()) : resource;
        try {
            resources.insert(toCreate);
        } catch (StorageException e) {
            throw ApiException.database("unable to create resource", toCreate, e);
        }
        log.info("Created resource {}", toCreate.id());
        return toCreate;
    }

    public Resource update(UUID id, ResourcePatch patch) {
        Map<String, Object> input = Map.of("id", id, "resource", patch);
        Resource current;
        try {
            current = resources.findById(id).orElseThrow(() -> ApiException.notFound(NOT_FOUND, input));
        } catch (StorageException e) {
            throw ApiException.database("unable to get existing resource", input, e);
        }

        Resource merged = patch.applyTo(current);
        if (merged.name() == null || merged.name().isBlank()) {
            throw ApiException.invalidRequest("invalid resource", input, Map.of("name", "must not be blank"));
        }
        try {
            if (!resources.update(merged)) {
                throw ApiException.notFound(NOT_FOUND, input);
            }
        } catch (StorageException e) {
            throw ApiException.database("unable to update resource", input, e);
        }
        return merged;
    }

    /** Writes the resource under the given id, creating it if it does not exist. */
    public Resource replace(UUID id, Resource resource) {
        Resource replacement = resource.withId(id);
        try {
            if (!resources.update(replacement)) {
                resources.insert(replacement);
                log.info("Created resource {} by replacement", id);
            }
        } catch (StorageException e) {
            throw ApiException.database("unable to replace resource", replacement, e);
        }
        return replacement;
    }

    public void delete(UUID id) {
        boolean deleted;
        try {
            deleted = resources.delete(id);
        } catch (StorageException e) {
            throw ApiException.database("unable to delete resource", id, e);
        }
        if (!deleted) {
            throw ApiException.notFound(NOT_FOUND, id);
        }
        log.info("Deleted resource {}", id);
    }
}
