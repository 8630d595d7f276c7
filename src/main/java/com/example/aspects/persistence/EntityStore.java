package com.example.aspects.persistence;

import com.example.aspects.model.Actor;
import com.example.aspects.model.Item;

import java.util.Collection;
import java.util.Optional;

/**
 * Read model and mutation surface of the document store that holds actors
 * and items. Mutations happen on the returned objects; every participant
 * observes them once propagated.
 */
public interface EntityStore {

    Optional<Actor> findActor(String actorId);

    Collection<Actor> actors();

    void saveActor(Actor actor);

    /** Owned items are looked up on their owner; unowned ones in the shared library. */
    Optional<Item> findItem(String itemId);

    <T extends Item> Optional<T> findItem(String itemId, Class<T> type);

    Collection<Item> libraryItems();

    void saveLibraryItem(Item item);

    /** Removes an item from its owner or the library. Returns false when unknown. */
    boolean deleteItem(String itemId);
}
