package com.tradestore.mapper;

import com.tradestore.api.dto.request.AccountCreateRequest;
import com.tradestore.api.dto.response.AccountResponse;
import com.tradestore.domain.model.Account;
import com.tradestore.entity.AccountEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for accounts: entity, domain model, request and response DTOs.
 *
 * <p>createdAt and lastUpdate are never taken from a request; the entity fills createdAt on
 * insert and the service stamps lastUpdate on balance changes.
 */
@Mapper
public interface AccountMapper {

    AccountEntity toEntity(Account account);

    Account toDomain(AccountEntity entity);

    List<Account> toDomainList(List<AccountEntity> entities);

    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "lastUpdate", ignore = true)
    Account toDomain(AccountCreateRequest request);

    AccountResponse toResponse(Account account);

    List<AccountResponse> toResponseList(List<Account> accounts);
}
