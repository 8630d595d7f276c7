package com.example.aspects.persistence;

import com.example.aspects.model.Actor;
import com.example.aspects.model.Item;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link EntityStore} shared by every participant in one process.
 */
public class InMemoryEntityStore implements EntityStore {

    private final Map<String, Actor> actors = new ConcurrentHashMap<>();
    private final Map<String, Item> library = new ConcurrentHashMap<>();

    @Override
    public Optional<Actor> findActor(String actorId) {
        if (actorId == null) return Optional.empty();
        return Optional.ofNullable(actors.get(actorId));
    }

    @Override
    public Collection<Actor> actors() {
        return Collections.unmodifiableCollection(new ArrayList<>(actors.values()));
    }

    @Override
    public void saveActor(Actor actor) {
        actors.put(actor.getId(), actor);
    }

    @Override
    public Optional<Item> findItem(String itemId) {
        if (itemId == null) return Optional.empty();
        for (Actor a : actors.values()) {
            Optional<Item> owned = a.findItem(itemId);
            if (owned.isPresent()) return owned;
        }
        return Optional.ofNullable(library.get(itemId));
    }

    @Override
    public <T extends Item> Optional<T> findItem(String itemId, Class<T> type) {
        return findItem(itemId).filter(type::isInstance).map(type::cast);
    }

    @Override
    public Collection<Item> libraryItems() {
        return Collections.unmodifiableCollection(new ArrayList<>(library.values()));
    }

    @Override
    public void saveLibraryItem(Item item) {
        item.setOwnerId(null);
        library.put(item.getId(), item);
    }

    @Override
    public boolean deleteItem(String itemId) {
        Optional<Item> item = findItem(itemId);
        if (item.isEmpty()) return false;
        Item i = item.get();
        Actor owner = i.getOwnerId() != null ? actors.get(i.getOwnerId()) : null;
        if (owner != null) return owner.removeItem(i);
        return library.remove(itemId) != null;
    }
}
