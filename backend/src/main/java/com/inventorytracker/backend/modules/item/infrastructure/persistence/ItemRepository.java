package com.inventorytracker.backend.modules.item.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.inventorytracker.backend.modules.item.domain.Item;

public interface ItemRepository extends JpaRepository<Item, Long> {

    /**
     * Single-statement delete.
     *
     * @return number of rows removed, 0 when no item has the id
     */
    @Modifying(clearAutomatically = true)
    @Query("delete from Item i where i.id = :id")
    int deleteItemById(@Param("id") Long id);
}
