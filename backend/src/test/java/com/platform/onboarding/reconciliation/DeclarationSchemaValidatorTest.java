package com.platform.onboarding.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.onboarding.error.ErrorCode;
import com.platform.onboarding.error.ValidationException;
import com.platform.onboarding.schema.SchemaMap;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeclarationSchemaValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DeclarationSchemaValidator validator =
        new DeclarationSchemaValidator(SchemaMap.standard(), List.of("1.30.0"));

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    private ValidationException rejected(String declaration) throws Exception {
        JsonNode node = json(declaration);
        return assertThrows(ValidationException.class, () -> validator.validate(node));
    }

    @Test
    void GIVEN_valid_declaration_WHEN_validated_THEN_accepted() throws Exception {
        JsonNode declaration = json("{'schemaVersion':'1.30.0','class':'Device','async':true,"
            + "'controls':{'trace':true},'Common':{'class':'Tenant','hostname':'bigip.example.com',"
            + "'sys':{'class':'System','consoleTimeout':30},"
            + "'external':{'class':'VLAN','tag':4094,'interfaces':[{'name':'1.1','tagged':false}]},"
            + "'mon1':{'class':'GSLBMonitor','monitorType':'http'}}}");

        assertDoesNotThrow(() -> validator.validate(declaration));
    }

    @Test
    void GIVEN_unsupported_version_WHEN_validated_THEN_rejected_with_version_code() throws Exception {
        ValidationException e = rejected("{'schemaVersion':'0.1.0','class':'Device','Common':{'class':'Tenant'}}");

        assertEquals(ErrorCode.UNSUPPORTED_SCHEMA_VERSION, e.getErrorCode());
    }

    @Test
    void GIVEN_array_WHEN_validated_THEN_rejected_as_invalid_request() throws Exception {
        ValidationException e = rejected("[]");

        assertEquals(ErrorCode.INVALID_REQUEST, e.getErrorCode());
    }

    @Test
    void GIVEN_several_problems_WHEN_validated_THEN_all_reported() throws Exception {
        ValidationException e = rejected("{'schemaVersion':'1.30.0','class':'Device','extra':1,"
            + "'Common':{'class':'Tenant',"
            + "'v1':{'class':'VLAN','tag':'abc','colour':'red'},"
            + "'thing':{'class':'Teleporter'}}}");

        assertEquals(ErrorCode.VALIDATION_ERROR, e.getErrorCode());
        assertThat(e.getProblems(), hasSize(4));
        assertThat(e.getProblems(), hasItem("unknown property 'extra'"));
        assertThat(e.getProblems(), hasItem("Common.v1.tag: expected an integer"));
        assertThat(e.getProblems(), hasItem("Common.v1: unknown property 'colour'"));
        assertThat(e.getProblems(), hasItem(containsString("unknown class 'Teleporter'")));
    }

    @Test
    void GIVEN_bad_object_name_WHEN_validated_THEN_rejected() throws Exception {
        ValidationException e = rejected("{'schemaVersion':'1.30.0','class':'Device',"
            + "'Common':{'class':'Tenant','bad name':{'class':'VLAN','tag':1}}}");

        assertThat(e.getProblems(), hasItem("Common.bad name: invalid object name"));
    }

    @Test
    void GIVEN_monitor_without_known_type_WHEN_validated_THEN_rejected() throws Exception {
        ValidationException e = rejected("{'schemaVersion':'1.30.0','class':'Device',"
            + "'Common':{'class':'Tenant','mon1':{'class':'GSLBMonitor','monitorType':'smtp'}}}");

        assertThat(e.getProblems(), hasItem(containsString("Common.mon1.monitorType")));
    }

    @Test
    void GIVEN_wrong_root_class_WHEN_validated_THEN_rejected() throws Exception {
        ValidationException e = rejected("{'schemaVersion':'1.30.0','class':'ADC','Common':{'class':'Tenant'}}");

        assertThat(e.getProblems(), hasItem("class must be 'Device'"));
    }

    @Test
    void GIVEN_malformed_key_material_WHEN_validated_THEN_each_bad_value_reported() throws Exception {
        ValidationException e = rejected("{'schemaVersion':'1.30.0','class':'Device','Common':{'class':'Tenant',"
            + "'cert':{'class':'DeviceCertificate','certificate':{'base64':'Q0VSVA=='},'privateKey':{'base64':'abcde'}},"
            + "'auth':{'class':'Authentication','enabledSourceType':'ldap',"
            + "'ldap':{'servers':['10.0.0.5'],'sslCaCert':{'base64':'Q0E='},'sslClientKey':{'base64':7}}}}}");

        assertEquals(ErrorCode.VALIDATION_ERROR, e.getErrorCode());
        assertThat(e.getProblems(), hasSize(2));
        assertThat(e.getProblems(), hasItem("Common.cert.privateKey.base64: invalid base64"));
        assertThat(e.getProblems(), hasItem("Common.auth.ldap.sslClientKey.base64: invalid base64"));
    }

    @Test
    void GIVEN_wrapped_base64_WHEN_validated_THEN_accepted() throws Exception {
        JsonNode declaration = json("{'schemaVersion':'1.30.0','class':'Device','Common':{'class':'Tenant',"
            + "'cert':{'class':'DeviceCertificate','certificate':{'base64':'LS0tLS1CRUdJTiBD\\nRVJUSUZJQ0FURS0tLS0t'}}}}");

        assertDoesNotThrow(() -> validator.validate(declaration));
    }
}
