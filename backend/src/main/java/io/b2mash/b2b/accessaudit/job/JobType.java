package io.b2mash.b2b.accessaudit.job;

public enum JobType {
  ADHOC,
  PLAYBOOK
}
