/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import net.scoreworks.relationtools.annotations.HasMany;
import net.scoreworks.relationtools.exceptions.IllegalRecordTypeException;
import org.apache.commons.lang3.ClassUtils;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Class to cache information about a {@link Record} class, so it doesn't have to be obtained with reflections each
 * time a record of that class is constructed or one of its relations is accessed.
 */
class RecordMetadata {

    /** Store {@link RecordMetadata} of analyzed classes for quick access */
    private static final Map<Class<? extends Record>, RecordMetadata> metadata = new HashMap<>();

    /**
     * Class-type whose content is described
     */
    final Class<? extends Record> clazz;

    /**
     * No-argument constructor used to create fresh, unsaved instances (for bulk loading and cloning)
     */
    private final Constructor<? extends Record> constructor;

    /**
     * Relations declared with {@link HasMany} on the class and its superclasses, keyed by relation name in declaration
     * order. Subclasses override declarations of the same name
     */
    private final Map<String, Relation<?>> relations;

    private RecordMetadata(Class<? extends Record> clazz) {
        this.clazz = clazz;
        if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers()))
            throw new IllegalRecordTypeException(clazz, "is abstract and can't be instantiated!");
        try {
            constructor = clazz.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new IllegalRecordTypeException(clazz, "needs to have a default constructor with no input arguments!", e);
        }
        relations = Collections.unmodifiableMap(traceDeclaredRelations());
    }

    static synchronized RecordMetadata of(Class<? extends Record> clazz) {
        RecordMetadata info = metadata.get(clazz);
        if (info == null) {
            info = new RecordMetadata(clazz);
            metadata.put(clazz, info);
        }
        return info;
    }

    /**
     * Construct a fresh, unsaved instance of the given record class
     */
    static <R extends Record> R construct(Class<R> clazz) {
        RecordMetadata info = of(clazz);
        info.constructor.setAccessible(true);
        try {
            return clazz.cast(info.constructor.newInstance());
        } catch (InvocationTargetException e) {
            throw new IllegalRecordTypeException(clazz, "threw while invoking its constructor", e.getTargetException());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalRecordTypeException(clazz, "can't be instantiated", e);
        }
    }

    /**
     * Construct a fresh instance of the same class as the given record
     */
    @SuppressWarnings("unchecked")
    static <R extends Record> R constructLike(R record) {
        return construct((Class<R>) record.getClass());
    }

    Map<String, Relation<?>> getDeclaredRelations() {
        return relations;
    }

    List<Relation<?>> getRelationsToKeepUpdated() {
        List<Relation<?>> keptUpdated = new ArrayList<>();
        for (Relation<?> relation : relations.values()) {
            if (relation.isKeptUpdated())
                keptUpdated.add(relation);
        }
        return keptUpdated;
    }


    //==========PRIVATE METHODS====================================================

    private Map<String, Relation<?>> traceDeclaredRelations() {
        //collect the class hierarchy from the topmost record class down, so subclasses override their parents
        List<Class<?>> hierarchy = ClassUtils.getAllSuperclasses(clazz);
        Collections.reverse(hierarchy);
        hierarchy.add(clazz);

        Map<String, Relation<?>> declared = new LinkedHashMap<>();
        for (Class<?> type : hierarchy) {
            for (HasMany declaration : type.getDeclaredAnnotationsByType(HasMany.class)) {
                if (Modifier.isAbstract(declaration.child().getModifiers()))
                    throw new IllegalRecordTypeException(clazz, "declares relation \"" + declaration.name()
                            + "\" with abstract child type " + declaration.child().getSimpleName() + "!");
                declared.put(declaration.name(), Relation.fromDeclaration(declaration));
            }
        }
        return declared;
    }

    @Override
    public String toString() {
        StringBuilder strb = new StringBuilder();
        strb.append(">Info of ").append(clazz.getSimpleName()).append(":");
        if (!relations.isEmpty()) {
            strb.append("\nrelations: ");
            for (Relation<?> relation : relations.values()) {
                strb.append(relation).append(" ");
            }
        }
        return strb.append("\n").toString();
    }
}
