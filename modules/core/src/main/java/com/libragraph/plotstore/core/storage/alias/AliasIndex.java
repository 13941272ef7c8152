package com.libragraph.plotstore.core.storage.alias;

import com.libragraph.plotstore.core.storage.AliasAlreadyExistsException;
import com.libragraph.plotstore.core.storage.PermissionDeniedException;
import com.libragraph.plotstore.core.storage.UnknownImageException;
import com.libragraph.plotstore.core.storage.ValidationException;
import com.libragraph.plotstore.core.storage.metadata.ImageMetadata;
import com.libragraph.plotstore.core.storage.metadata.MetadataRepository;
import com.libragraph.plotstore.util.Aliases;
import com.libragraph.plotstore.util.ImageIds;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;

/**
 * In-memory alias lookup: group → alias → GUID and GUID → alias.
 *
 * <p>Holds no state of its own on disk. The maps are rebuilt from the metadata
 * records at construction and kept in step with them afterwards: every mutation
 * writes the record and updates the maps under the same write lock.
 *
 * <p>An alias lives in the scope of the group that registered it, which may differ from
 * the image's own group when a group names a public image; the record keeps that scope.
 * Aliases registered with a null group live in the public scope.
 */
public class AliasIndex {

    private static final Logger log = Logger.getLogger(AliasIndex.class);

    /** Map key for a group scope; a null group is the public scope. */
    private record Scope(String group) {
        static final Scope PUBLIC = new Scope(null);

        static Scope of(String group) {
            return group == null ? PUBLIC : new Scope(group);
        }
    }

    private final MetadataRepository metadata;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Scope, Map<String, String>> guidByAlias = new HashMap<>();
    private final Map<String, String> aliasByGuid = new HashMap<>();

    public AliasIndex(MetadataRepository metadata) {
        this.metadata = metadata;
        rebuild();
    }

    private void rebuild() {
        lock.writeLock().lock();
        try {
            guidByAlias.clear();
            aliasByGuid.clear();
            for (ImageMetadata record : metadata.listRecords(null)) {
                String alias = record.alias();
                if (alias == null) {
                    continue;
                }
                if (!Aliases.isValid(alias)) {
                    log.warnf("Ignoring malformed alias '%s' on %s", alias, record.guid());
                    continue;
                }
                String scopeGroup = record.aliasScope();
                Map<String, String> scope = guidByAlias.computeIfAbsent(Scope.of(scopeGroup), s -> new HashMap<>());
                String claimed = scope.putIfAbsent(alias, record.guid());
                if (claimed != null) {
                    log.warnf("Alias '%s' in group '%s' claimed by both %s and %s, keeping %s",
                            alias, scopeGroup, claimed, record.guid(), claimed);
                    continue;
                }
                aliasByGuid.put(record.guid(), alias);
            }
            log.infof("Alias index rebuilt: %d aliases", aliasByGuid.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Resolves an identifier to a GUID.
     *
     * <p>A canonical GUID is returned unchanged without consulting the alias maps, so an
     * alias that happens to look like a GUID is never reachable through lookup. Other
     * identifiers are looked up in the caller's group, then in the public scope.
     */
    public Optional<String> resolveIdentifier(String identifier, String group) {
        if (identifier == null || identifier.isEmpty()) {
            return Optional.empty();
        }
        if (ImageIds.isCanonical(identifier)) {
            return Optional.of(identifier);
        }
        lock.readLock().lock();
        try {
            String guid = lookup(Scope.of(group), identifier);
            if (guid == null && group != null) {
                guid = lookup(Scope.PUBLIC, identifier);
            }
            return Optional.ofNullable(guid);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * True when {@code alias} is registered in some non-null group other than
     * {@code group}, meaning the name exists but the caller may not see it.
     */
    public boolean isClaimedByOtherGroup(String alias, String group) {
        lock.readLock().lock();
        try {
            for (Map.Entry<Scope, Map<String, String>> entry : guidByAlias.entrySet()) {
                Scope scope = entry.getKey();
                if (scope.group() != null && !scope.group().equals(group)
                        && entry.getValue().containsKey(alias)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    private String lookup(Scope scope, String alias) {
        Map<String, String> aliases = guidByAlias.get(scope);
        return aliases == null ? null : aliases.get(alias);
    }

    /**
     * Assigns {@code alias} to {@code guid} within {@code group}.
     * Re-registering the same pair is a no-op. A GUID carries at most one alias: a
     * previous alias on the same image is released.
     *
     * @throws ValidationException if the alias or GUID is malformed
     * @throws AliasAlreadyExistsException if the alias maps to another image in this group
     * @throws UnknownImageException if there is no record for {@code guid}
     * @throws PermissionDeniedException if the image belongs to another group
     */
    public void registerAlias(String alias, String guid, String group) {
        requireValidAlias(alias);
        if (!ImageIds.isCanonical(guid)) {
            throw new ValidationException("Invalid GUID format: " + guid);
        }

        lock.writeLock().lock();
        try {
            Scope scope = Scope.of(group);
            String existing = lookup(scope, alias);
            if (existing != null) {
                if (existing.equals(guid)) {
                    return;
                }
                throw new AliasAlreadyExistsException(alias, group, existing);
            }

            ImageMetadata record = metadata.get(guid)
                    .orElseThrow(() -> new UnknownImageException(guid));
            if (!record.accessibleFrom(group)) {
                throw new PermissionDeniedException(guid, group);
            }

            metadata.update(guid, r -> r.withAlias(alias, group))
                    .orElseThrow(() -> new UnknownImageException(guid));

            String previous = aliasByGuid.put(guid, alias);
            if (previous != null) {
                dropFromScopes(previous, guid);
                log.infof("Alias '%s' replaced by '%s' on %s", previous, alias, guid);
            }
            guidByAlias.computeIfAbsent(scope, s -> new HashMap<>()).put(alias, guid);
            log.infof("Alias registered: %s -> %s (group=%s)", alias, guid, group);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes an alias from {@code group} and strips it from the image's record.
     *
     * @return false if the alias was not registered in that group
     */
    public boolean unregisterAlias(String alias, String group) {
        lock.writeLock().lock();
        try {
            Scope scope = Scope.of(group);
            String guid = lookup(scope, alias);
            if (guid == null) {
                return false;
            }
            metadata.update(guid, r -> r.withAlias(null, null));
            guidByAlias.get(scope).remove(alias);
            aliasByGuid.remove(guid);
            log.infof("Alias unregistered: %s -> %s (group=%s)", alias, guid, group);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs {@code deletion} (removal of the image's record) and drops the image's alias
     * in the same critical section.
     *
     * @return the result of {@code deletion}
     */
    public boolean evict(String guid, BooleanSupplier deletion) {
        lock.writeLock().lock();
        try {
            boolean deleted = deletion.getAsBoolean();
            String alias = aliasByGuid.remove(guid);
            if (alias != null) {
                dropFromScopes(alias, guid);
                log.debugf("Alias '%s' released with %s", alias, guid);
            }
            return deleted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void dropFromScopes(String alias, String guid) {
        for (Map<String, String> aliases : guidByAlias.values()) {
            aliases.remove(alias, guid);
        }
    }

    public Optional<String> getAlias(String guid) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(aliasByGuid.get(guid));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Aliases registered in exactly {@code group} (null for the public scope), sorted by alias.
     */
    public Map<String, String> listAliases(String group) {
        lock.readLock().lock();
        try {
            Map<String, String> aliases = guidByAlias.get(Scope.of(group));
            return aliases == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new TreeMap<>(aliases));
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void requireValidAlias(String alias) {
        try {
            Aliases.requireValid(alias);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }
}
