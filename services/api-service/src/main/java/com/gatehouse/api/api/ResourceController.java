package com.gatehouse.api.api;

import com.gatehouse.api.application.ResourceService;
import com.gatehouse.api.domain.PageQuery;
import com.gatehouse.api.domain.Resource;
import com.gatehouse.api.domain.ResourcePatch;
import com.gatehouse.api.infrastructure.web.CurrentUser;
import com.gatehouse.security.Principal;
import com.gatehouse.security.Scope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * CRUD over resources. Reads need {@code resources:read}, writes {@code resources:write}; every
 * route also needs {@code user:read}, as the current-user lookup does, and an active caller.
 */
@RestController
@RequestMapping("/resources")
public class ResourceController {

    private final ResourceService resourceService;

    public ResourceController(ResourceService resourceService) {
        this.resourceService = resourceService;
    }

    @GetMapping({"", "/"})
    public List<Resource> list(
            @CurrentUser({Scope.RESOURCES_READ, Scope.USER_READ}) Principal user,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "" + PageQuery.DEFAULT_SIZE) @Min(1) @Max(PageQuery.MAX_SIZE) int size) {
        return resourceService.list(new PageQuery(skip, size));
    }

    @GetMapping("/{id}")
    public Resource get(
            @CurrentUser({Scope.RESOURCES_READ, Scope.USER_READ}) Principal user,
            @PathVariable UUID id) {
        return resourceService.get(id);
    }

    @PostMapping({"", "/"})
    @ResponseStatus(HttpStatus.CREATED)
    public Resource create(
            @CurrentUser({Scope.RESOURCES_WRITE, Scope.USER_READ}) Principal user,
            @Valid @RequestBody Resource resource) {
        return resourceService.create(resource);
    }

    @PatchMapping("/{id}")
    public Resource update(
            @CurrentUser({Scope.RESOURCES_WRITE, Scope.USER_READ}) Principal user,
            @PathVariable UUID id,
            @RequestBody ResourcePatch patch) {
        return resourceService.update(id, patch);
    }

    @PutMapping("/{id}")
    public Resource replace(
            @CurrentUser({Scope.RESOURCES_WRITE, Scope.USER_READ}) Principal user,
            @PathVariable UUID id,
            @Valid @RequestBody Resource resource) {
        return resourceService.replace(id, resource);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            @CurrentUser({Scope.RESOURCES_WRITE, Scope.USER_READ}) Principal user,
            @PathVariable UUID id) {
        resourceService.delete(id);
    }
}
