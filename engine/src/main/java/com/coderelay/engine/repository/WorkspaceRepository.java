package com.coderelay.engine.repository;

import com.coderelay.engine.model.Workspace;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkspaceRepository extends JpaRepository<Workspace, String> {

    List<Workspace> findAllByOrderByIdAsc();
}
