package io.b2mash.b2b.accessaudit.audit.login;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class LoginTypeConverter implements AttributeConverter<LoginType, String> {

  @Override
  public String convertToDatabaseColumn(LoginType attribute) {
    return attribute != null ? attribute.code() : null;
  }

  @Override
  public LoginType convertToEntityAttribute(String dbData) {
    return dbData != null ? LoginType.fromCode(dbData) : null;
  }
}
