/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import net.scoreworks.relationtools.annotations.HasMany;
import net.scoreworks.relationtools.exceptions.InvalidRelationRequestException;
import net.scoreworks.relationtools.exceptions.UnknownRelationException;
import org.apache.commons.collections4.ListUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * An {@link ActiveRecord} that keeps its one-to-many relations in sync with storage. Relations are declared with
 * {@link HasMany} and exposed by the subclass through typed accessors backed by {@link #getRelated(String)} and
 * {@link #setRelated(String, List)}.
 * <p>
 * Assigning a collection to a relation records the collection it held before as snapshot. Saving the relation diffs
 * the snapshot against the assigned collection by identity: every assigned record is saved with the parent's key as
 * foreign key, every snapshot record missing from the assigned collection is deleted.
 * <pre>
 * Order order = ActiveRecord.findOne(Order.class, 1);
 * if (order.load(post)) {
 *     order.loadRelations(post, List.of("items"));
 *     order.saveWithRelations(true);
 * }
 * </pre>
 * Saving and deleting relations is not transactional. Partial failures are reported, not rolled back.
 */
public abstract class RelationalRecord extends ActiveRecord {
    private static final Logger LOGGER = LoggerFactory.getLogger(RelationalRecord.class);

    private final RelationRegistry registry = new RelationRegistry(getClass());

    private final Snapshots snapshots = new Snapshots();

    /** desired collection of each relation that was read or assigned so far */
    private final Map<String, List<Record>> related = new HashMap<>();

    /** whether a failing cascade on delete prevents the deletion of this record */
    private boolean cascadeDeleteBlocking;

    private boolean lastCascadeDeleteSuccessful = true;


    //==========REGISTRATION====================================================

    /**
     * @return the declared relations whose children are deleted, loaded and cloned together with this record
     */
    public List<Relation<?>> getRelationsToKeepUpdated() {
        return RecordMetadata.of(getClass()).getRelationsToKeepUpdated();
    }

    /**
     * Register a relation that isn't declared with {@link HasMany}. From now on it can be reconciled like a declared one
     */
    public void registerRelation(Relation<?> relation) {
        registry.register(relation);
    }

    /**
     * Resolve a relation, registering its declaration on first use
     * @throws UnknownRelationException if the relation is neither registered nor declared
     */
    public Relation<?> getRelation(String name) {
        if (!registry.isRegistered(name)) {
            Relation<?> declared = RecordMetadata.of(getClass()).getDeclaredRelations().get(name);
            if (declared != null)
                registry.register(declared);
        }
        return registry.resolve(name);
    }

    public RelationRegistry getRelationRegistry() {
        return registry;
    }


    //==========ASSIGNMENT====================================================

    /**
     * Read the desired collection of a relation. On first access it is fetched from storage
     * @return a copy of the collection. Modifying it has no effect until it is assigned with {@link #setRelated}
     */
    @SuppressWarnings("unchecked")
    public <C extends Record> List<C> getRelated(String name) {
        return new ArrayList<>((List<C>) desired(name));
    }

    /**
     * Assign the desired collection of a relation. The previous collection becomes the snapshot the next save diffs
     * against, and every record gets the current local key of this record as foreign key
     */
    public void setRelated(String name, List<? extends Record> records) {
        Relation<?> relation = getRelation(name);
        checkChildTypes(relation, records);
        snapshots.capture(name, desired(name));
        Reconciler.propagateForeignKey(records, relation.getLink(), getAttribute(relation.getLink().getLocalKey()));
        related.put(name, new ArrayList<>(records));
    }

    /**
     * Replace the desired collection of a relation without touching its snapshot or foreign keys
     */
    public void populateRelation(String name, List<? extends Record> records) {
        Relation<?> relation = getRelation(name);
        checkChildTypes(relation, records);
        related.put(name, new ArrayList<>(records));
    }

    /**
     * Make the current desired collection the snapshot, e.g. after a save when the relation is saved again without
     * being reassigned
     */
    public void resyncRelation(String name) {
        getRelation(name);
        snapshots.capture(name, desired(name));
    }

    /**
     * @return the collection the relation held before its last assignment, empty if it was never assigned
     */
    public List<Record> getRelatedSnapshot(String name) {
        getRelation(name);
        return snapshots.get(name);
    }

    /**
     * @return true if the relation was assigned at least once and therefore takes part in the cascades
     */
    public boolean isRelationAssigned(String name) {
        return snapshots.contains(name);
    }

    List<Record> desired(String name) {
        List<Record> records = related.get(name);
        if (records == null) {
            records = fetch(getRelation(name));
            related.put(name, records);
        }
        return ListUtils.unmodifiableList(records);
    }

    List<Record> snapshot(String name) {
        return snapshots.get(name);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private List<Record> fetch(Relation<?> relation) {
        Object key = getAttribute(relation.getLink().getLocalKey());
        if (key == null || !ActiveRecord.class.isAssignableFrom(relation.getChildType()))
            return new ArrayList<>();
        Class<? extends ActiveRecord> childType = (Class) relation.getChildType();
        LOGGER.debug("fetching relation {}.{}", this, relation.getName());
        return new ArrayList<>(ActiveRecord.findAll(childType, Map.of(relation.getLink().getForeignKey(), key)));
    }

    private void checkChildTypes(Relation<?> relation, List<? extends Record> records) {
        for (Record record : records) {
            if (!relation.getChildType().isInstance(record))
                throw new IllegalArgumentException("relation " + relation + " can't hold " + record.getClass().getSimpleName());
        }
    }


    //==========SINGLE RELATION====================================================

    public boolean validateRelation(String name) {
        return validateRelation(name, null, true);
    }

    /**
     * Validate all records of a relation, skipping the foreign key
     * @param attributeNames attributes to validate, null for all
     * @return true if every record is valid
     */
    public boolean validateRelation(String name, @Nullable Collection<String> attributeNames, boolean clearErrors) {
        return new Reconciler(this, getRelation(name)).validate(attributeNames, clearErrors);
    }

    /**
     * @return the errors of each record of the relation that has errors
     */
    public List<Map<String, List<String>>> getRelationErrors(String name) {
        return new Reconciler(this, getRelation(name)).errors();
    }

    public boolean saveRelation(String name) {
        return saveRelation(name, true, null);
    }

    /**
     * Save all records of the relation and delete records that were removed from it since the last assignment
     * @return true if every save and delete succeeded
     */
    public boolean saveRelation(String name, boolean runValidation, @Nullable Collection<String> attributeNames) {
        return new Reconciler(this, getRelation(name)).save(runValidation, attributeNames);
    }

    /**
     * Delete all records currently held by the relation
     */
    public boolean deleteRelation(String name) {
        return new Reconciler(this, getRelation(name)).delete();
    }


    //==========ALL ASSIGNED RELATIONS====================================================

    public boolean validateRelations() {
        boolean valid = true;
        for (String name : assignedRelations()) {
            if (!validateRelation(name, null, true))
                valid = false;
        }
        return valid;
    }

    /**
     * @return errors of the relations that have any, keyed by relation name
     */
    public Map<String, List<Map<String, List<String>>>> getRelationsErrors() {
        Map<String, List<Map<String, List<String>>>> errors = new LinkedHashMap<>();
        for (String name : assignedRelations()) {
            List<Map<String, List<String>>> relationErrors = getRelationErrors(name);
            if (!relationErrors.isEmpty())
                errors.put(name, relationErrors);
        }
        return errors;
    }

    public boolean saveRelations() {
        return saveRelations(true);
    }

    /**
     * Save all assigned relations
     * @param runValidation validate all relations first and save nothing if any record is invalid
     */
    public boolean saveRelations(boolean runValidation) {
        if (runValidation && !validateRelations()) {
            LOGGER.info("Relations of {} not saved due to validation error.", this);
            return false;
        }
        boolean success = true;
        for (String name : assignedRelations()) {
            if (!saveRelation(name, false, null))
                success = false;
        }
        return success;
    }

    public boolean deleteRelations() {
        boolean success = true;
        for (String name : assignedRelations()) {
            if (!deleteRelation(name))
                success = false;
        }
        return success;
    }

    /**
     * Save this record and afterwards all assigned relations, so children of a new record receive its generated key
     * @param runValidation validate this record and all relations first, saving nothing if anything is invalid
     */
    public boolean saveWithRelations(boolean runValidation) {
        if (runValidation) {
            boolean valid = validate(null, true);
            if (!validateRelations())
                valid = false;
            if (!valid) {
                LOGGER.info("{} and its relations not saved due to validation error.", this);
                return false;
            }
        }
        if (!save(false, null))
            return false;
        return saveRelations(false);
    }

    private List<String> assignedRelations() {
        return new ArrayList<>(snapshots.names());
    }


    //==========DELETION====================================================

    /**
     * Deletes the children of all relations to keep updated before this record is deleted. By default, a failing
     * cascade is only reported and the record is deleted anyway, see {@link #setCascadeDeleteBlocking(boolean)}
     */
    @Override
    protected boolean beforeDelete() {
        if (!super.beforeDelete())
            return false;
        boolean success = true;
        for (Relation<?> relation : getRelationsToKeepUpdated()) {
            if (!deleteRelation(relation.getName()))
                success = false;
        }
        lastCascadeDeleteSuccessful = success;
        if (!success) {
            LOGGER.warn("Not all relations of {} could be deleted", this);
            return !cascadeDeleteBlocking;
        }
        return true;
    }

    public void setCascadeDeleteBlocking(boolean cascadeDeleteBlocking) {
        this.cascadeDeleteBlocking = cascadeDeleteBlocking;
    }

    public boolean isCascadeDeleteBlocking() {
        return cascadeDeleteBlocking;
    }

    /**
     * @return whether all children were deleted by the last cascade on delete
     */
    public boolean isLastCascadeDeleteSuccessful() {
        return lastCascadeDeleteSuccessful;
    }


    //==========LOADING====================================================

    /**
     * Merge the rows of the payload into the named relations and assign the result. Relations without input in the
     * payload are left untouched
     * @param relationNames relations to load, each must be kept updated
     * @throws InvalidRelationRequestException if a relation isn't kept updated
     */
    public void loadRelations(Map<String, ?> data, Collection<String> relationNames) {
        Map<String, Relation<?>> keptUpdated = new LinkedHashMap<>();
        for (Relation<?> relation : getRelationsToKeepUpdated()) {
            keptUpdated.put(relation.getName(), relation);
        }
        List<Relation<?>> useRelations = new ArrayList<>();
        for (String name : relationNames) {
            if (!keptUpdated.containsKey(name))
                throw new InvalidRelationRequestException(getClass(), name);
            useRelations.add(keptUpdated.get(name));
        }
        for (Relation<?> relation : useRelations) {
            loadRelation(relation, data);
        }
    }

    private <C extends Record> void loadRelation(Relation<C> relation, Map<String, ?> data) {
        List<C> existing = getRelated(relation.getName());
        MergeResult<C> result = PayloadMerger.mergeFromPayload(relation.getChildType(), existing, data, null);
        if (result.hasInput())
            setRelated(relation.getName(), result.getRecords());
    }

    /**
     * Back-fill identities from the payload onto the records of every relation to keep updated, by position
     */
    public void loadRelationsPrimaries(Map<String, ?> data) {
        for (Relation<?> relation : getRelationsToKeepUpdated()) {
            String scope = RecordMetadata.construct(relation.getChildType()).formName();
            if (data.get(scope) != null) {
                List<Record> records = getRelated(relation.getName());
                setRelated(relation.getName(), PayloadMerger.mergeIdentityOnly(records, PayloadMerger.rows(data.get(scope))));
            }
        }
    }


    //==========CLONING AND FILTERING====================================================

    /**
     * Copy the records of a relation into new, unsaved records without their identities. Nothing is persisted
     */
    public List<Record> cloneRelation(String name) {
        List<Record> clones = new ArrayList<>();
        for (Record record : desired(name)) {
            Record clone = RecordMetadata.constructLike(record);
            Map<String, Object> attributes = record.getAttributes();
            attributes.remove(record.primaryKey());
            clone.setAttributes(attributes);
            clones.add(clone);
        }
        return clones;
    }

    /**
     * Keep only the records of a relation whose attributes equal all given values, in their current order. The
     * snapshot is left untouched, so records filtered out get deleted on the next save
     */
    public void filterRelation(String name, Map<String, ?> condition) {
        List<Record> filtered = new ArrayList<>();
        for (Record record : desired(name)) {
            if (matches(record, condition))
                filtered.add(record);
        }
        related.put(name, filtered);
    }

    private static boolean matches(Record record, Map<String, ?> condition) {
        for (Map.Entry<String, ?> entry : condition.entrySet()) {
            if (!record.attributes().contains(entry.getKey()))
                return false;
            Object value = record.getAttribute(entry.getKey());
            if (value == null || !value.equals(entry.getValue()))
                return false;
        }
        return true;
    }

    /**
     * Create an unsaved copy of this record and of the children of every relation to keep updated. Saving the copy
     * with {@link #saveWithRelations(boolean)} persists the whole copied graph
     */
    public RelationalRecord deepClone() {
        RelationalRecord clone = RecordMetadata.constructLike(this);
        Map<String, Object> attributes = getAttributes();
        attributes.remove(primaryKey());
        clone.setAttributes(attributes);
        for (Relation<?> relation : getRelationsToKeepUpdated()) {
            clone.setRelated(relation.getName(), cloneRelation(relation.getName()));
        }
        return clone;
    }
}
