package com.storyscene.backend.generation.repo;

import com.storyscene.backend.generation.entity.CharacterReferenceSheetEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface CharacterReferenceSheetRepository extends JpaRepository<CharacterReferenceSheetEntity, String> {

    List<CharacterReferenceSheetEntity> findByCharacterIdInAndApprovedTrueOrderByCreatedAtUtcDesc(Collection<String> characterIds);
}
