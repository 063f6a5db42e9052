package io.b2mash.b2b.accessaudit.audit.relation;

/**
 * How changes to one relation are described in operate logs.
 *
 * @param category resource type label of the records
 * @param addTemplate template for added members, e.g. {@code {User} JOINED {UserGroup}}
 * @param removeTemplate template for removed or cleared members
 */
public record RelationAuditTemplate(String category, String addTemplate, String removeTemplate) {}
