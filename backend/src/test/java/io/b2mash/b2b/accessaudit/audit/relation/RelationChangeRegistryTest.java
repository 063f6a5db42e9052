package io.b2mash.b2b.accessaudit.audit.relation;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.accessaudit.asset.Asset;
import io.b2mash.b2b.accessaudit.identity.User;
import io.b2mash.b2b.accessaudit.permission.AssetPermission;
import org.junit.jupiter.api.Test;

class RelationChangeRegistryTest {

  private final RelationChangeRegistry registry = new RelationChangeRegistry();

  @Test
  void lookup_returnsTemplatesOfRegisteredRelations() {
    var groups = registry.lookup(User.GROUPS.name());

    assertThat(groups).isPresent();
    assertThat(groups.get().category()).isEqualTo("User and Group");
    assertThat(groups.get().addTemplate()).isEqualTo("{User} JOINED {UserGroup}");
    assertThat(groups.get().removeTemplate()).isEqualTo("{User} LEFT {UserGroup}");
  }

  @Test
  void lookup_coversAllAuditedRelations() {
    assertThat(registry.relationNames())
        .containsExactlyInAnyOrder(
            User.GROUPS.name(),
            Asset.NODES.name(),
            AssetPermission.USERS.name(),
            AssetPermission.USER_GROUPS.name(),
            AssetPermission.ASSETS.name(),
            AssetPermission.NODES.name());
  }

  @Test
  void lookup_unregisteredRelationIsEmpty() {
    assertThat(registry.lookup("Job.assets")).isEmpty();
  }

  @Test
  void format_substitutesOwnerAndRelated() {
    var resource =
        RelationChangeRegistry.format(
            "{User} JOINED {UserGroup}", "User", "Alice(alice)", "UserGroup", "admins");

    assertThat(resource).isEqualTo("Alice(alice) JOINED admins");
  }

  @Test
  void format_usesNameKeysRegardlessOfOrder() {
    var resource =
        RelationChangeRegistry.format(
            "{Node} ADD {Asset}", "Asset", "web-1(10.0.0.5)", "Node", "/Default");

    assertThat(resource).isEqualTo("/Default ADD web-1(10.0.0.5)");
  }

  @Test
  void format_doesNotReExpandSubstitutedValues() {
    var resource =
        RelationChangeRegistry.format(
            "{User} JOINED {UserGroup}", "User", "{UserGroup}", "UserGroup", "$1 admins");

    assertThat(resource).isEqualTo("{UserGroup} JOINED $1 admins");
  }

  @Test
  void format_leavesUnknownPlaceholders() {
    var resource =
        RelationChangeRegistry.format("{Owner} ADD {User}", "AssetPermission", "p1", "User", "bob");

    assertThat(resource).isEqualTo("{Owner} ADD bob");
  }

  @Test
  void format_truncatesTo128CodePoints() {
    var resource =
        RelationChangeRegistry.format(
            "{AssetPermission} ADD {User}", "AssetPermission", "p".repeat(200), "User", "bob");

    assertThat(resource).hasSize(128).isEqualTo("p".repeat(128));
  }
}
