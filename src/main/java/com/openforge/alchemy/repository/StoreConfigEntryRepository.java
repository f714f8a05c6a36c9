package com.openforge.alchemy.repository;

import com.openforge.alchemy.domain.StoreConfigEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StoreConfigEntryRepository extends JpaRepository<StoreConfigEntry, String> {
}
