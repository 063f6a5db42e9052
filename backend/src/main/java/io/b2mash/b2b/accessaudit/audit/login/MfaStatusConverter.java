package io.b2mash.b2b.accessaudit.audit.login;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class MfaStatusConverter implements AttributeConverter<MfaStatus, Integer> {

  @Override
  public Integer convertToDatabaseColumn(MfaStatus attribute) {
    return attribute != null ? attribute.code() : null;
  }

  @Override
  public MfaStatus convertToEntityAttribute(Integer dbData) {
    return dbData != null ? MfaStatus.fromCode(dbData) : null;
  }
}
