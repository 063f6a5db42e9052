package io.b2mash.b2b.accessaudit.audit;

public enum FtpOperation {
  UPLOAD,
  DOWNLOAD,
  DELETE,
  RENAME,
  MKDIR,
  RMDIR,
  SYMLINK
}
