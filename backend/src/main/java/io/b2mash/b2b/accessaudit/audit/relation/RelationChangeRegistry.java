package io.b2mash.b2b.accessaudit.audit.relation;

import io.b2mash.b2b.accessaudit.asset.Asset;
import io.b2mash.b2b.accessaudit.audit.AuditText;
import io.b2mash.b2b.accessaudit.identity.User;
import io.b2mash.b2b.accessaudit.permission.AssetPermission;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Relations whose membership changes are audited, keyed by relation name. Relations not listed
 * here produce no operate log. The table is fixed at construction and never modified.
 */
@Component
public class RelationChangeRegistry {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

  private final Map<String, RelationAuditTemplate> templates;

  public RelationChangeRegistry() {
    var table = new LinkedHashMap<String, RelationAuditTemplate>();
    table.put(
        User.GROUPS.name(),
        new RelationAuditTemplate(
            "User and Group", "{User} JOINED {UserGroup}", "{User} LEFT {UserGroup}"));
    table.put(
        Asset.NODES.name(),
        new RelationAuditTemplate("Node and Asset", "{Node} ADD {Asset}", "{Node} REMOVE {Asset}"));
    table.put(
        AssetPermission.USERS.name(),
        new RelationAuditTemplate(
            "User asset permissions",
            "{AssetPermission} ADD {User}",
            "{AssetPermission} REMOVE {User}"));
    table.put(
        AssetPermission.USER_GROUPS.name(),
        new RelationAuditTemplate(
            "User group asset permissions",
            "{AssetPermission} ADD {UserGroup}",
            "{AssetPermission} REMOVE {UserGroup}"));
    table.put(
        AssetPermission.ASSETS.name(),
        new RelationAuditTemplate(
            "Asset permission",
            "{AssetPermission} ADD {Asset}",
            "{AssetPermission} REMOVE {Asset}"));
    table.put(
        AssetPermission.NODES.name(),
        new RelationAuditTemplate(
            "Node permission", "{AssetPermission} ADD {Node}", "{AssetPermission} REMOVE {Node}"));
    this.templates = Map.copyOf(table);
  }

  public Optional<RelationAuditTemplate> lookup(String relationName) {
    return Optional.ofNullable(templates.get(relationName));
  }

  public Set<String> relationNames() {
    return templates.keySet();
  }

  /**
   * Substitutes {@code {ownerTypeName}} and {@code {relatedTypeName}} in one pass. Substituted
   * values are never expanded again and unknown placeholders stay as written. The result is cut
   * to {@link AuditText#RESOURCE_MAX_LENGTH} code points.
   */
  public static String format(
      String template,
      String ownerTypeName,
      String ownerDisplay,
      String relatedTypeName,
      String relatedDisplay) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    var sb = new StringBuilder(template.length() + 32);
    while (matcher.find()) {
      String key = matcher.group(1);
      String value;
      if (key.equals(ownerTypeName)) {
        value = ownerDisplay;
      } else if (key.equals(relatedTypeName)) {
        value = relatedDisplay;
      } else {
        value = matcher.group();
      }
      matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(value)));
    }
    matcher.appendTail(sb);
    return AuditText.truncate(sb.toString(), AuditText.RESOURCE_MAX_LENGTH);
  }
}
