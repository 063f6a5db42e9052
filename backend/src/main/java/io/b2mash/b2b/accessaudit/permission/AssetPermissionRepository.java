package io.b2mash.b2b.accessaudit.permission;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AssetPermissionRepository extends JpaRepository<AssetPermission, UUID> {}
